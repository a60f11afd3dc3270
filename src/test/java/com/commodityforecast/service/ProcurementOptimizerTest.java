package com.commodityforecast.service;

import com.commodityforecast.TestForecasts;
import com.commodityforecast.config.AnalysisConfig;
import com.commodityforecast.exception.InvalidInputException;
import com.commodityforecast.exception.NoFeasibleSolutionException;
import com.commodityforecast.model.Forecast;
import com.commodityforecast.model.InventoryPosition;
import com.commodityforecast.model.InventoryStatus;
import com.commodityforecast.model.OrderPlan;
import com.commodityforecast.model.ProcurementPlan;
import com.commodityforecast.model.SupplierCost;
import com.commodityforecast.model.SupplierQuote;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ProcurementOptimizerTest {

    private final ProcurementOptimizer optimizer = new ProcurementOptimizer();
    private final AnalysisConfig config = AnalysisConfig.defaults().toBuilder()
        .holdingCostRate(0.001)
        .orderingCost(500.0)
        .build();

    @Test
    void optimizeOrderQuantity_neverWorseThanBaseline() {
        Forecast forecast = TestForecasts.forecast("cpo", 800, 805, 812, 808, 815, 820, 818, 825);

        OrderPlan best = optimizer.optimizeOrderQuantity(forecast, 0.001, 500.0, 100.0, config);
        OrderPlan baseline = optimizer.baseline(forecast, 0.001, 500.0, 100.0);

        assertThat(best.getTotalCost()).isLessThanOrEqualTo(baseline.getTotalCost());
        assertThat(baseline.getQuantity()).isEqualTo(700.0);
        assertThat(baseline.getTimingStep()).isZero();
        assertThat(best.getTotalDemand()).isEqualTo(700.0);
    }

    @Test
    void optimizeOrderQuantity_waitsForPriceDip() {
        Forecast forecast = TestForecasts.forecast("cpo", 800, 790, 700, 760, 790);

        OrderPlan best = optimizer.optimizeOrderQuantity(forecast, 0.001, 500.0, 50.0, config);

        assertThat(best.getTimingStep()).isEqualTo(2);
        assertThat(best.getUnitPrice()).isEqualTo(700.0);
    }

    @Test
    void optimizeOrderQuantity_prefersEarliestTimingOnTies() {
        Forecast flat = TestForecasts.flatForecast("cpo", 800.0, 6);

        OrderPlan best = optimizer.optimizeOrderQuantity(flat, 0.001, 500.0, 10.0, config);

        assertThat(best.getTimingStep()).isZero();
    }

    @Test
    void optimizeOrderQuantity_respectsCapacity() {
        Forecast flat = TestForecasts.flatForecast("cpo", 800.0, 10);
        AnalysisConfig capped = config.toBuilder().maxOrderQuantity(120.0).build();

        OrderPlan best = optimizer.optimizeOrderQuantity(flat, 0.0001, 500.0, 100.0, capped);

        assertThat(best.getQuantity()).isLessThanOrEqualTo(120.0);
        assertThat(best.getOrderCount()).isGreaterThanOrEqualTo(9);
    }

    @Test
    void optimizeOrderQuantity_failsWhenMinimumExceedsCapacity() {
        Forecast flat = TestForecasts.flatForecast("cpo", 800.0, 5);
        AnalysisConfig impossible = config.toBuilder().minOrderQuantity(500.0).maxOrderQuantity(100.0).build();

        assertThatThrownBy(() -> optimizer.optimizeOrderQuantity(flat, 0.001, 500.0, 10.0, impossible))
            .isInstanceOf(NoFeasibleSolutionException.class)
            .satisfies(ex -> assertThat(((NoFeasibleSolutionException) ex).getStage())
                .isEqualTo(ProcurementOptimizer.STAGE));
    }

    @Test
    void optimizeOrderQuantity_rejectsZeroHorizonAndDemand() {
        Forecast single = TestForecasts.forecast("cpo", 800.0);
        Forecast flat = TestForecasts.flatForecast("cpo", 800.0, 5);

        assertThatThrownBy(() -> optimizer.optimizeOrderQuantity(single, 0.001, 500.0, 10.0, config))
            .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> optimizer.optimizeOrderQuantity(flat, 0.001, 500.0, 0.0, config))
            .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void rankSuppliers_ordersByLandedCost() {
        Forecast forecast = TestForecasts.flatForecast("cpo", 800.0, 5);
        List<SupplierQuote> quotes = List.of(
            SupplierQuote.builder().name("premium").pricePremium(0.05).build(),
            SupplierQuote.builder().name("cheap-unreliable").unitPrice(790.0).reliability(0.6).qualityScore(0.7).build(),
            SupplierQuote.builder().name("quoted").unitPrice(795.0).logisticsCostPerUnit(2.0).build(),
            SupplierQuote.builder().name("bulk-only").unitPrice(700.0).minOrderQuantity(10_000).build());

        List<SupplierCost> ranked = optimizer.rankSuppliers(quotes, forecast, 100.0, config);

        assertThat(ranked).extracting(SupplierCost::getSupplier).doesNotContain("bulk-only");
        assertThat(ranked).hasSize(3);
        for (int i = 1; i < ranked.size(); i++) {
            assertThat(ranked.get(i).getTotalCost()).isGreaterThanOrEqualTo(ranked.get(i - 1).getTotalCost());
        }
        SupplierCost premium = ranked.stream().filter(c -> c.getSupplier().equals("premium")).findFirst().orElseThrow();
        assertThat(premium.getUnitPrice()).isCloseTo(840.0, within(1e-9));
        SupplierCost risky = ranked.stream().filter(c -> c.getSupplier().equals("cheap-unreliable")).findFirst()
            .orElseThrow();
        assertThat(risky.getReliabilityPremium()).isPositive();
        assertThat(risky.getQualityAdjustment()).isPositive();
    }

    @Test
    void rankSuppliers_paymentTermsReduceCost() {
        Forecast forecast = TestForecasts.flatForecast("cpo", 800.0, 5);
        List<SupplierQuote> quotes = List.of(
            SupplierQuote.builder().name("cash").unitPrice(800.0).build(),
            SupplierQuote.builder().name("net90").unitPrice(800.0).paymentTermsDays(90).build());

        List<SupplierCost> ranked = optimizer.rankSuppliers(quotes, forecast, 100.0, config);

        assertThat(ranked.get(0).getSupplier()).isEqualTo("net90");
        assertThat(ranked.get(0).getFinancingCost()).isNegative();
    }

    @Test
    void rankSuppliers_failsWhenEverySupplierNeedsLargerOrder() {
        Forecast forecast = TestForecasts.flatForecast("cpo", 800.0, 5);
        List<SupplierQuote> quotes = List.of(SupplierQuote.builder().name("bulk").minOrderQuantity(1_000).build());

        assertThatThrownBy(() -> optimizer.rankSuppliers(quotes, forecast, 100.0, config))
            .isInstanceOf(NoFeasibleSolutionException.class);
    }

    @Test
    void plan_reportsSavingsAgainstBaseline() {
        Forecast forecast = TestForecasts.forecast("cpo", 800, 790, 780, 785, 795, 800);

        ProcurementPlan plan = optimizer.plan(forecast, null, List.of(), 200.0, config);

        assertThat(plan.getProjectedSavings()).isGreaterThanOrEqualTo(0.0);
        assertThat(plan.getTimingSavings()).isGreaterThanOrEqualTo(0.0);
        assertThat(plan.getBaselineCost() - plan.getOrder().getTotalCost())
            .isCloseTo(plan.getProjectedSavings(), within(1e-6));
        assertThat(plan.getSuppliers()).isEmpty();
        assertThat(plan.getVariable()).isEqualTo("cpo");
    }

    @Test
    void optimizeOrderQuantity_capsQuantityAtStorageHeadroom() {
        Forecast flat = TestForecasts.flatForecast("cpo", 800.0, 30);
        InventoryPosition inventory = InventoryPosition.builder()
            .currentInventory(900.0)
            .storageCapacity(1_000.0)
            .safetyStockDays(5)
            .build();

        OrderPlan unbounded = optimizer.optimizeOrderQuantity(flat, 0.0001, 500.0, 10.0, config);
        OrderPlan bounded = optimizer.optimizeOrderQuantity(flat, 0.0001, 500.0, 10.0, inventory, config);

        assertThat(unbounded.getQuantity()).isGreaterThan(100.0);
        assertThat(bounded.getQuantity()).isCloseTo(100.0, within(1e-6));
        assertThat(bounded.getOrderCount()).isEqualTo(3);
    }

    @Test
    void optimizeOrderQuantity_floorsQuantityAtSafetyStock() {
        Forecast flat = TestForecasts.flatForecast("cpo", 800.0, 30);
        InventoryPosition inventory = InventoryPosition.builder().currentInventory(0.0).build();

        OrderPlan unbounded = optimizer.optimizeOrderQuantity(flat, 0.01, 10.0, 10.0, config);
        OrderPlan floored = optimizer.optimizeOrderQuantity(flat, 0.01, 10.0, 10.0, inventory, config);

        assertThat(unbounded.getQuantity()).isLessThan(150.0);
        assertThat(floored.getQuantity()).isCloseTo(150.0, within(1e-6));
    }

    @Test
    void optimizeOrderQuantity_failsWhenStorageIsFull() {
        Forecast flat = TestForecasts.flatForecast("cpo", 800.0, 30);
        InventoryPosition full = InventoryPosition.builder().currentInventory(1_000.0).storageCapacity(1_000.0).build();

        assertThatThrownBy(() -> optimizer.optimizeOrderQuantity(flat, 0.001, 500.0, 10.0, full, config))
            .isInstanceOf(NoFeasibleSolutionException.class)
            .hasMessageContaining("Storage is full");
    }

    @Test
    void optimizeOrderQuantity_failsWhenSafetyStockExceedsHeadroom() {
        Forecast flat = TestForecasts.flatForecast("cpo", 800.0, 30);
        InventoryPosition tight = InventoryPosition.builder().currentInventory(950.0).storageCapacity(1_000.0).build();

        assertThatThrownBy(() -> optimizer.optimizeOrderQuantity(flat, 0.001, 500.0, 10.0, tight, config))
            .isInstanceOf(NoFeasibleSolutionException.class)
            .hasMessageContaining("No order quantity");
    }

    @Test
    void inventoryStatus_reportsShortageBelowTargetCover() {
        InventoryPosition inventory = InventoryPosition.builder()
            .currentInventory(200.0)
            .storageCapacity(1_000.0)
            .build();

        InventoryStatus status = optimizer.inventoryStatus(inventory, 10.0);

        assertThat(status.getSafetyStock()).isEqualTo(150.0);
        assertThat(status.getReorderPoint()).isEqualTo(300.0);
        assertThat(status.getDaysOfSupply()).isEqualTo(20.0);
        assertThat(status.getTargetStock()).isEqualTo(450.0);
        assertThat(status.getShortage()).isEqualTo(250.0);
        assertThat(status.getExcessInventory()).isZero();
        assertThat(status.isReorderNow()).isTrue();
        assertThat(status.getAvailableCapacity()).isEqualTo(800.0);
    }

    @Test
    void inventoryStatus_reportsExcessAboveTargetCover() {
        InventoryPosition inventory = InventoryPosition.builder().currentInventory(600.0).build();

        InventoryStatus status = optimizer.inventoryStatus(inventory, 10.0);

        assertThat(status.getExcessInventory()).isEqualTo(150.0);
        assertThat(status.getShortage()).isZero();
        assertThat(status.isReorderNow()).isFalse();
        assertThat(status.getAvailableCapacity()).isNull();
    }

    @Test
    void inventoryStatus_rejectsNegativeStock() {
        InventoryPosition negative = InventoryPosition.builder().currentInventory(-1.0).build();

        assertThatThrownBy(() -> optimizer.inventoryStatus(negative, 10.0))
            .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void plan_reportsInventoryStatusAndRespectsHeadroom() {
        Forecast flat = TestForecasts.flatForecast("cpo", 800.0, 30);
        InventoryPosition inventory = InventoryPosition.builder()
            .currentInventory(100.0)
            .storageCapacity(300.0)
            .safetyStockDays(5)
            .build();

        ProcurementPlan plan = optimizer.plan(flat, null, List.of(), 10.0, inventory, config);

        assertThat(plan.getOrder().getQuantity()).isLessThanOrEqualTo(200.0 + 1e-9);
        assertThat(plan.getInventory()).isNotNull();
        assertThat(plan.getInventory().getDaysOfSupply()).isEqualTo(10.0);
        assertThat(plan.getInventory().getAvailableCapacity()).isEqualTo(200.0);
    }
}
