package org.carball.fincalc.benchmark;

import org.carball.fincalc.model.benchmark.BenchmarkMetric;
import org.carball.fincalc.model.benchmark.BenchmarkRange;
import org.carball.fincalc.model.benchmark.BenchmarkTemplate;
import org.carball.fincalc.model.benchmark.IndustryBenchmark;
import org.carball.fincalc.model.benchmark.TemplateBand;
import org.carball.fincalc.model.benchmark.TemplateMetric;
import org.carball.fincalc.model.breakeven.BreakEvenInput;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BenchmarkCatalogTest {

    private BenchmarkCatalog catalog;

    @BeforeEach
    void setUp() {
        catalog = BenchmarkCatalog.loadDefault();
    }

    @Test
    void shouldLoadBundledIndustriesInFileOrder() {
        assertThat(catalog.industries())
                .containsExactly("restaurant", "ecommerce", "services", "retail", "manufacturing");
    }

    @Test
    void shouldCoverEveryMetricForEveryIndustry() {
        for (String industry : catalog.industries()) {
            assertThat(catalog.industry(industry).metrics())
                    .as("metrics for %s", industry)
                    .containsOnlyKeys(BenchmarkMetric.values());
        }
    }

    @Test
    void shouldReadPercentileBands() {
        // When
        IndustryBenchmark restaurant = catalog.industry("restaurant");

        // Then
        assertThat(restaurant.displayName()).isEqualTo("Restaurant / Food Service");
        assertThat(restaurant.range(BenchmarkMetric.GROSS_MARGIN_PERCENT))
                .isEqualTo(new BenchmarkRange(55, 62, 70, 65));
        assertThat(restaurant.range(BenchmarkMetric.CURRENT_RATIO).median()).isEqualTo(1.2);
    }

    @Test
    void shouldListKpisPerIndustry() {
        assertThat(catalog.kpis("ecommerce")).hasSize(6);
        assertThat(catalog.kpis("restaurant").get(0).name()).isEqualTo("Food Cost");
        assertThat(catalog.kpis("restaurant").get(0).targetValue()).isEqualTo(28.0);
        assertThat(catalog.kpis("unknown")).isEmpty();
    }

    @Test
    void shouldRejectUnknownIndustry() {
        assertThat(catalog.findIndustry("aerospace")).isEmpty();

        assertThatThrownBy(() -> catalog.industry("aerospace"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Industry not found: aerospace")
                .hasMessageContaining("restaurant");
    }

    @Test
    void shouldLoadBusinessTemplates() {
        // When
        BenchmarkTemplate retail = catalog.template("retail");

        // Then
        assertThat(catalog.templateIds()).hasSize(5).contains("restaurant", "manufacturing");
        assertThat(retail.name()).isEqualTo("Retail Store");
        assertThat(retail.band(TemplateMetric.LABOR_COST_RATIO)).isEqualTo(new TemplateBand(15, 25, 18));
        assertThat(catalog.templatesByIndustry("services"))
                .extracting(BenchmarkTemplate::id)
                .containsExactly("services");
    }

    @Test
    void shouldPrefillBreakEvenInputFromTemplate() {
        // When
        BreakEvenInput input = catalog.breakEvenInput("manufacturing");

        // Then
        assertThat(input.getFixedCosts()).isEqualTo(50000.0);
        assertThat(input.getPricePerUnit()).isEqualTo(100.0);
        assertThat(input.getVariableCostPerUnit()).isEqualTo(55.0);
        assertThat(input.getPeriodMonths()).isEqualTo(12);
    }

    @Test
    void shouldRejectUnknownTemplate() {
        assertThatThrownBy(() -> catalog.template("bakery"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Template not found: bakery");
    }

    @Test
    void shouldBuildFromSuppliedData() {
        // Given
        IndustryBenchmark custom = new IndustryBenchmark("saas", "SaaS",
                Map.of(BenchmarkMetric.GROSS_MARGIN_PERCENT, new BenchmarkRange(60, 70, 80, 75)), List.of());

        // When
        BenchmarkCatalog customCatalog = new BenchmarkCatalog(List.of(custom), List.of());

        // Then
        assertThat(customCatalog.industries()).containsExactly("saas");
        assertThat(customCatalog.templates()).isEmpty();
        assertThatThrownBy(() -> customCatalog.industry("saas").range(BenchmarkMetric.NET_MARGIN_PERCENT))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
