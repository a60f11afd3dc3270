package com.commodityforecast.service;

import com.commodityforecast.config.AnalysisConfig;
import com.commodityforecast.exception.InvalidInputException;
import com.commodityforecast.exception.NoFeasibleSolutionException;
import com.commodityforecast.model.Forecast;
import com.commodityforecast.model.InventoryPosition;
import com.commodityforecast.model.InventoryStatus;
import com.commodityforecast.model.OrderPlan;
import com.commodityforecast.model.ProcurementPlan;
import com.commodityforecast.model.RiskAssessment;
import com.commodityforecast.model.SupplierCost;
import com.commodityforecast.model.SupplierQuote;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Order sizing and timing against the forecast price path, and supplier landed-cost ranking.
 */
@Slf4j
@Service
public class ProcurementOptimizer {

    static final String STAGE = "procurement";

    private static final double EPS = 1e-9;

    /**
     * Searches every timing {@code t = 0..H} and candidate quantity for the lowest
     * {@code S*D/Q + h*P_t*(Q/2)*H + P_t*D}; ties keep the earlier timing and then the smaller quantity.
     */
    public OrderPlan optimizeOrderQuantity(Forecast forecast, double holdingCostRate, double orderingCost,
                                           double demandRate, AnalysisConfig config) {
        return optimizeOrderQuantity(forecast, holdingCostRate, orderingCost, demandRate, null, config);
    }

    /**
     * As above, with the quantity capped by the storage headroom and floored at the safety stock
     * (or the whole demand when that is smaller).
     */
    public OrderPlan optimizeOrderQuantity(Forecast forecast, double holdingCostRate, double orderingCost,
                                           double demandRate, InventoryPosition inventory, AnalysisConfig config) {
        return search(forecast, holdingCostRate, orderingCost, demandRate, inventory, config, forecast.getHorizon());
    }

    public InventoryStatus inventoryStatus(InventoryPosition inventory, double demandRate) {
        validate(inventory);
        if (!(demandRate > 0.0) || Double.isInfinite(demandRate)) {
            throw new InvalidInputException(STAGE, "Demand rate must be positive", Map.of("demandRate", demandRate));
        }
        double current = inventory.getCurrentInventory();
        double target = demandRate * inventory.getTargetDaysOfSupply();
        double reorderPoint = inventory.reorderPoint(demandRate);
        return InventoryStatus.builder()
            .currentInventory(current)
            .safetyStock(inventory.safetyStock(demandRate))
            .reorderPoint(reorderPoint)
            .daysOfSupply(current / demandRate)
            .targetStock(target)
            .excessInventory(Math.max(0.0, current - target))
            .shortage(Math.max(0.0, target - current))
            .reorderNow(current <= reorderPoint)
            .availableCapacity(inventory.headroom())
            .build();
    }

    /** One order for the whole demand placed now. */
    public OrderPlan baseline(Forecast forecast, double holdingCostRate, double orderingCost, double demandRate) {
        requireDemand(forecast, demandRate);
        int horizon = forecast.getHorizon();
        double demand = demandRate * horizon;
        return order(demand, 0, forecast.primary().at(0).point(), demand, horizon, holdingCostRate, orderingCost);
    }

    public List<SupplierCost> rankSuppliers(List<SupplierQuote> quotes, Forecast forecast, double quantity,
                                            AnalysisConfig config) {
        if (quotes == null || quotes.isEmpty()) {
            throw new NoFeasibleSolutionException(STAGE, "No supplier quotes to rank", Map.of("quantity", quantity));
        }
        if (!(quantity > 0.0)) {
            throw new InvalidInputException(STAGE, "Order quantity must be positive", Map.of("quantity", quantity));
        }
        Forecast.VariableForecast path = forecast.primary();
        double meanPrice = path.meanPoint();
        double financingRate = Math.max(0.0, config.getWorkingCapitalRate() + annualizedDrift(forecast, config));

        List<SupplierCost> costs = new ArrayList<>();
        for (SupplierQuote quote : quotes) {
            validate(quote);
            if (quote.getMinOrderQuantity() > quantity) {
                log.warn("Supplier {} excluded: minimum order {} exceeds quantity {}", quote.getName(),
                    quote.getMinOrderQuantity(), quantity);
                continue;
            }
            costs.add(landedCost(quote, meanPrice, quantity, financingRate, config));
        }
        if (costs.isEmpty()) {
            throw new NoFeasibleSolutionException(STAGE,
                "Every supplier requires a minimum order above " + quantity,
                Map.of("quantity", quantity, "suppliers", quotes.size()));
        }
        costs.sort(Comparator.comparingDouble(SupplierCost::getTotalCost).thenComparing(SupplierCost::getSupplier));
        return List.copyOf(costs);
    }

    public ProcurementPlan plan(Forecast forecast, RiskAssessment risk, List<SupplierQuote> quotes,
                                double demandRate, AnalysisConfig config) {
        return plan(forecast, risk, quotes, demandRate, null, config);
    }

    public ProcurementPlan plan(Forecast forecast, RiskAssessment risk, List<SupplierQuote> quotes,
                                double demandRate, InventoryPosition inventory, AnalysisConfig config) {
        double holdingCostRate = config.getHoldingCostRate();
        double orderingCost = config.getOrderingCost();
        InventoryStatus status = inventory != null ? inventoryStatus(inventory, demandRate) : null;
        OrderPlan best = optimizeOrderQuantity(forecast, holdingCostRate, orderingCost, demandRate, inventory, config);
        OrderPlan immediate = search(forecast, holdingCostRate, orderingCost, demandRate, inventory, config, 0);
        OrderPlan naive = baseline(forecast, holdingCostRate, orderingCost, demandRate);
        List<SupplierCost> suppliers = quotes == null || quotes.isEmpty()
            ? List.of()
            : rankSuppliers(quotes, forecast, best.getQuantity(), config);

        log.info("Procurement plan for {}: Q={} at step {} costing {} (baseline {})",
            forecast.primary().getVariable(), best.getQuantity(), best.getTimingStep(), best.getTotalCost(),
            naive.getTotalCost());
        return ProcurementPlan.builder()
            .forecastId(forecast.getForecastId())
            .variable(forecast.primary().getVariable())
            .order(best)
            .baselineCost(naive.getTotalCost())
            .projectedSavings(naive.getTotalCost() - best.getTotalCost())
            .timingSavings(immediate.getTotalCost() - best.getTotalCost())
            .suppliers(suppliers)
            .riskLevel(risk != null ? risk.getRiskLevel() : null)
            .inventory(status)
            .build();
    }

    private OrderPlan search(Forecast forecast, double holdingCostRate, double orderingCost, double demandRate,
                             InventoryPosition inventory, AnalysisConfig config, int lastTiming) {
        requireDemand(forecast, demandRate);
        if (holdingCostRate < 0 || orderingCost < 0) {
            throw new InvalidInputException(STAGE, "Cost parameters must be non-negative",
                Map.of("holdingCostRate", holdingCostRate, "orderingCost", orderingCost));
        }
        int horizon = forecast.getHorizon();
        double demand = demandRate * horizon;
        double lower = config.getMinOrderQuantity();
        double upper = config.getMaxOrderQuantity() != null ? Math.min(config.getMaxOrderQuantity(), demand) : demand;
        if (inventory != null) {
            validate(inventory);
            lower = Math.max(lower, Math.min(inventory.safetyStock(demandRate), demand));
            Double headroom = inventory.headroom();
            if (headroom != null) {
                if (!(headroom > 0.0)) {
                    throw new NoFeasibleSolutionException(STAGE, "Storage is full, no room for another order",
                        Map.of("currentInventory", inventory.getCurrentInventory(),
                            "storageCapacity", inventory.getStorageCapacity()));
                }
                upper = Math.min(upper, headroom);
            }
        }
        Forecast.VariableForecast path = forecast.primary();

        OrderPlan best = null;
        for (int t = 0; t <= lastTiming; t++) {
            double price = path.at(t).point();
            if (!(price > 0.0)) {
                log.warn("Timing {} skipped: non-positive forecast price {}", t, price);
                continue;
            }
            for (double quantity : candidates(lower, upper, demand, price, horizon, holdingCostRate, orderingCost,
                config.getQuantityGridSize())) {
                OrderPlan candidate = order(quantity, t, price, demand, horizon, holdingCostRate, orderingCost);
                if (best == null || candidate.getTotalCost() < best.getTotalCost() - EPS) {
                    best = candidate;
                }
            }
        }
        if (best == null) {
            throw new NoFeasibleSolutionException(STAGE,
                "No order quantity satisfies the constraints",
                Map.of("minOrderQuantity", lower, "maxOrderQuantity", upper, "demand", demand));
        }
        return best;
    }

    private static TreeSet<Double> candidates(double lower, double upper, double demand, double price, int horizon,
                                              double holdingCostRate, double orderingCost, int gridSize) {
        TreeSet<Double> quantities = new TreeSet<>();
        if (lower > upper + EPS) {
            return quantities;
        }
        for (int i = 0; i < gridSize; i++) {
            double q = lower + (upper - lower) * i / (gridSize - 1);
            if (q > 0.0) {
                quantities.add(q);
            }
        }
        if (demand >= lower && demand <= upper) {
            quantities.add(demand);
        }
        double holdingPerUnit = holdingCostRate * price * horizon;
        if (holdingPerUnit > 0.0) {
            double eoq = Math.sqrt(2.0 * orderingCost * demand / holdingPerUnit);
            if (eoq > 0.0 && eoq >= lower && eoq <= upper) {
                quantities.add(eoq);
            }
        }
        return quantities;
    }

    private static OrderPlan order(double quantity, int timing, double price, double demand, int horizon,
                                   double holdingCostRate, double orderingCost) {
        double ordering = orderingCost * demand / quantity;
        double holding = holdingCostRate * price * (quantity / 2.0) * horizon;
        double purchase = price * demand;
        return OrderPlan.builder()
            .quantity(quantity)
            .timingStep(timing)
            .orderCount((int) Math.ceil(demand / quantity - EPS))
            .unitPrice(price)
            .totalDemand(demand)
            .orderingCost(ordering)
            .holdingCost(holding)
            .purchaseCost(purchase)
            .totalCost(ordering + holding + purchase)
            .build();
    }

    private SupplierCost landedCost(SupplierQuote quote, double meanPrice, double quantity, double financingRate,
                                    AnalysisConfig config) {
        double unitPrice = quote.getUnitPrice() != null
            ? quote.getUnitPrice()
            : meanPrice * (1.0 + quote.getPricePremium());
        double procurement = unitPrice * quantity;
        double logistics = quote.getLogisticsCostPerUnit() * quantity;
        double deferred = procurement / Math.pow(1.0 + financingRate, quote.getPaymentTermsDays() / 365.0);
        double financing = -(procurement - deferred);
        double reliability = procurement * (1.0 - quote.getReliability()) * config.getReliabilityPenaltyRate();
        double quality = procurement * (1.0 - quote.getQualityScore()) * config.getQualityPenaltyRate();
        double total = procurement + logistics + financing + reliability + quality;
        return SupplierCost.builder()
            .supplier(quote.getName())
            .unitPrice(unitPrice)
            .procurementCost(procurement)
            .logisticsCost(logistics)
            .financingCost(financing)
            .reliabilityPremium(reliability)
            .qualityAdjustment(quality)
            .totalCost(total)
            .costPerUnit(total / quantity)
            .build();
    }

    /** Annualized relative change of the point forecast from step 0 to the horizon. */
    private static double annualizedDrift(Forecast forecast, AnalysisConfig config) {
        int horizon = forecast.getHorizon();
        Forecast.VariableForecast path = forecast.primary();
        double start = path.at(0).point();
        if (horizon == 0 || !(start > 0.0)) {
            return 0.0;
        }
        double end = path.at(horizon).point();
        return (end / start - 1.0) * config.getPeriodsPerYear() / horizon;
    }

    private static void validate(SupplierQuote quote) {
        if (quote.getName() == null || quote.getName().isBlank()) {
            throw new InvalidInputException(STAGE, "Supplier name is required", Map.of());
        }
        if (quote.getReliability() < 0 || quote.getReliability() > 1
            || quote.getQualityScore() < 0 || quote.getQualityScore() > 1) {
            throw new InvalidInputException(STAGE,
                "Supplier [" + quote.getName() + "] reliability and quality must lie in [0, 1]",
                Map.of("supplier", quote.getName(), "reliability", quote.getReliability(),
                    "qualityScore", quote.getQualityScore()));
        }
        if (quote.getPaymentTermsDays() < 0 || quote.getLogisticsCostPerUnit() < 0
            || (quote.getUnitPrice() != null && !(quote.getUnitPrice() > 0))) {
            throw new InvalidInputException(STAGE,
                "Supplier [" + quote.getName() + "] has negative terms or a non-positive price",
                Map.of("supplier", quote.getName()));
        }
    }

    private static void validate(InventoryPosition inventory) {
        double current = inventory.getCurrentInventory();
        Double capacity = inventory.getStorageCapacity();
        if (!(current >= 0.0) || Double.isInfinite(current) || (capacity != null && !(capacity > 0.0))) {
            throw new InvalidInputException(STAGE, "Inventory must be >= 0 and storage capacity > 0",
                Map.of("currentInventory", current, "storageCapacity", String.valueOf(capacity)));
        }
        if (inventory.getSafetyStockDays() < 0 || inventory.getLeadTimeDays() < 0
            || inventory.getTargetDaysOfSupply() < 0) {
            throw new InvalidInputException(STAGE, "Inventory day counts must be >= 0",
                Map.of("safetyStockDays", inventory.getSafetyStockDays(), "leadTimeDays", inventory.getLeadTimeDays(),
                    "targetDaysOfSupply", inventory.getTargetDaysOfSupply()));
        }
    }

    private static void requireDemand(Forecast forecast, double demandRate) {
        if (!(demandRate > 0.0) || Double.isInfinite(demandRate)) {
            throw new InvalidInputException(STAGE, "Demand rate must be positive", Map.of("demandRate", demandRate));
        }
        if (forecast.getHorizon() < 1) {
            throw new InvalidInputException(STAGE, "Planning needs a forecast horizon of at least one step",
                Map.of("horizon", forecast.getHorizon()));
        }
    }
}
