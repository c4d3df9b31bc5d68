package org.carball.fincalc.benchmark;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.carball.fincalc.model.benchmark.BenchmarkMetric;
import org.carball.fincalc.model.benchmark.BenchmarkRange;
import org.carball.fincalc.model.benchmark.BenchmarkTemplate;
import org.carball.fincalc.model.benchmark.IndustryBenchmark;
import org.carball.fincalc.model.benchmark.Kpi;
import org.carball.fincalc.model.benchmark.TemplateBand;
import org.carball.fincalc.model.benchmark.TemplateDefaults;
import org.carball.fincalc.model.benchmark.TemplateMetric;
import org.carball.fincalc.model.breakeven.BreakEvenInput;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only industry benchmarks and business templates.
 */
@Slf4j
public class BenchmarkCatalog {

    public static final String INDUSTRY_RESOURCE = "benchmarks/industry-benchmarks.yml";
    public static final String TEMPLATE_RESOURCE = "benchmarks/business-templates.yml";

    private final Map<String, IndustryBenchmark> industries;
    private final Map<String, BenchmarkTemplate> templates;

    public BenchmarkCatalog(List<IndustryBenchmark> industries, List<BenchmarkTemplate> templates) {
        Map<String, IndustryBenchmark> byIndustry = new LinkedHashMap<>();
        industries.forEach(i -> byIndustry.put(i.industry(), i));
        Map<String, BenchmarkTemplate> byId = new LinkedHashMap<>();
        templates.forEach(t -> byId.put(t.id(), t));
        this.industries = Collections.unmodifiableMap(byIndustry);
        this.templates = Collections.unmodifiableMap(byId);
    }

    /**
     * Loads the bundled benchmark data from the classpath.
     */
    public static BenchmarkCatalog loadDefault() {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        IndustryDocument industryDocument = read(mapper, INDUSTRY_RESOURCE, IndustryDocument.class);
        TemplateDocument templateDocument = read(mapper, TEMPLATE_RESOURCE, TemplateDocument.class);

        List<IndustryBenchmark> industries = new ArrayList<>();
        for (IndustryEntry entry : industryDocument.getIndustries()) {
            industries.add(entry.toBenchmark());
        }
        List<BenchmarkTemplate> templates = new ArrayList<>();
        for (TemplateEntry entry : templateDocument.getTemplates()) {
            templates.add(entry.toTemplate());
        }

        log.info("Loaded {} industry benchmarks and {} business templates", industries.size(), templates.size());
        return new BenchmarkCatalog(industries, templates);
    }

    private static <T> T read(ObjectMapper mapper, String resource, Class<T> type) {
        try (InputStream in = BenchmarkCatalog.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Benchmark resource not found on classpath: " + resource);
            }
            return mapper.readValue(in, type);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read benchmark resource " + resource, e);
        }
    }

    public List<String> industries() {
        return List.copyOf(industries.keySet());
    }

    public Optional<IndustryBenchmark> findIndustry(String industry) {
        return Optional.ofNullable(industries.get(industry));
    }

    public IndustryBenchmark industry(String industry) {
        return findIndustry(industry)
                .orElseThrow(() -> new IllegalArgumentException("Industry not found: " + industry
                        + ". Available industries: " + String.join(", ", industries.keySet())));
    }

    public List<Kpi> kpis(String industry) {
        return findIndustry(industry).map(IndustryBenchmark::kpis).orElse(List.of());
    }

    public List<String> templateIds() {
        return List.copyOf(templates.keySet());
    }

    public List<BenchmarkTemplate> templates() {
        return List.copyOf(templates.values());
    }

    public BenchmarkTemplate template(String id) {
        BenchmarkTemplate template = templates.get(id);
        if (template == null) {
            throw new IllegalArgumentException("Template not found: " + id);
        }
        return template;
    }

    public List<BenchmarkTemplate> templatesByIndustry(String industry) {
        return templates.values().stream()
                .filter(t -> t.industry().equals(industry))
                .toList();
    }

    /**
     * Break-even input pre-filled from a template; use {@code toBuilder()} to override fields.
     */
    public BreakEvenInput breakEvenInput(String templateId) {
        TemplateDefaults defaults = template(templateId).defaultInputs();
        return BreakEvenInput.builder()
                .fixedCosts(defaults.fixedCosts())
                .pricePerUnit(defaults.pricePerUnit())
                .variableCostPerUnit(defaults.variableCostPerUnit())
                .build();
    }

    @Data
    static class IndustryDocument {
        private List<IndustryEntry> industries = new ArrayList<>();
    }

    @Data
    static class IndustryEntry {
        private String industry;
        private String displayName;
        private Map<String, BenchmarkRange> metrics = new LinkedHashMap<>();
        private List<Kpi> kpis = new ArrayList<>();

        IndustryBenchmark toBenchmark() {
            Map<BenchmarkMetric, BenchmarkRange> ranges = new EnumMap<>(BenchmarkMetric.class);
            metrics.forEach((name, range) -> ranges.put(BenchmarkMetric.fromFieldName(name), range));
            for (BenchmarkMetric metric : BenchmarkMetric.values()) {
                if (!ranges.containsKey(metric)) {
                    log.warn("Industry {} has no {} benchmark", industry, metric.getFieldName());
                }
            }
            return new IndustryBenchmark(industry, displayName,
                    Collections.unmodifiableMap(ranges), List.copyOf(kpis));
        }
    }

    @Data
    static class TemplateDocument {
        private List<TemplateEntry> templates = new ArrayList<>();
    }

    @Data
    static class TemplateEntry {
        private String id;
        private String name;
        private String industry;
        private String description;
        private TemplateDefaults defaultInputs;
        private Map<String, TemplateBand> bands = new LinkedHashMap<>();

        BenchmarkTemplate toTemplate() {
            Map<TemplateMetric, TemplateBand> typed = new EnumMap<>(TemplateMetric.class);
            bands.forEach((metric, band) -> typed.put(TemplateMetric.fromFieldName(metric), band));
            return new BenchmarkTemplate(id, name, industry, description, defaultInputs,
                    Collections.unmodifiableMap(typed));
        }
    }
}
