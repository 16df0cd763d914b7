package com.airquality.karachi.utils;

import com.airquality.karachi.models.Aggregate;
import com.airquality.karachi.models.CalendarField;
import com.airquality.karachi.models.WindowPolicy;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable feature pipeline configuration.
 *
 * The builder defaults reproduce the Karachi AQI feature set: nine OpenWeather
 * channels, lags 1/3/6 on aqi, pm2_5 and pm10, a 3-row rolling mean/std on every
 * pollutant, the two pollutant ratios and aqi targets at +1 and +6 rows.
 */
public final class PipelineConfig {

    public static final List<String> DEFAULT_CHANNELS = List.of(
            "aqi", "co", "no", "no2", "o3", "so2", "pm2_5", "pm10", "nh3");

    private static final List<String> DEFAULT_POLLUTANTS = List.of(
            "co", "no", "no2", "o3", "so2", "pm2_5", "pm10", "nh3");

    private final List<String> channels;
    private final List<HorizonSpec> lags;
    private final List<WindowSpec> windows;
    private final List<HorizonSpec> targets;
    private final List<RatioSpec> ratios;
    private final List<ProductSpec> products;
    private final List<CalendarField> cyclicFields;
    private final boolean retainCalendarFields;
    private final WindowPolicy windowPolicy;
    private final double ratioEpsilon;
    private final double imputeDefault;
    private final int schemaVersion;

    private PipelineConfig(Builder b) {
        this.channels = List.copyOf(b.channels);
        this.lags = List.copyOf(b.lags != null ? b.lags : defaultLags(b.channels));
        this.windows = List.copyOf(b.windows != null ? b.windows : defaultWindows(b.channels));
        this.targets = List.copyOf(b.targets != null ? b.targets : defaultTargets(b.channels));
        this.ratios = List.copyOf(b.ratios != null ? b.ratios : defaultRatios(b.channels));
        this.products = List.copyOf(b.products != null ? b.products : defaultProducts(b.channels));
        this.cyclicFields = List.copyOf(new LinkedHashSet<>(b.cyclicFields));
        this.retainCalendarFields = b.retainCalendarFields;
        this.windowPolicy = b.windowPolicy;
        this.ratioEpsilon = b.ratioEpsilon;
        this.imputeDefault = b.imputeDefault;
        this.schemaVersion = b.schemaVersion;
        validate();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static PipelineConfig defaults() {
        return builder().build();
    }

    /**
     * Builds the configuration from environment variables, falling back to the defaults
     * for anything unset.
     */
    public static PipelineConfig fromEnvironment() {
        Builder b = builder();
        ConfigLoader.featureChannels().ifPresent(v -> b.channels(parseList(v)));
        ConfigLoader.featureLags().ifPresent(v -> b.lags(parseHorizons(v)));
        ConfigLoader.featureWindows().ifPresent(v -> b.windows(parseWindows(v)));
        ConfigLoader.featureTargets().ifPresent(v -> b.targets(parseHorizons(v)));
        return b.windowPolicy(ConfigLoader.windowPolicy())
                .ratioEpsilon(ConfigLoader.ratioEpsilon())
                .imputeDefault(ConfigLoader.imputeDefault())
                .retainCalendarFields(ConfigLoader.retainCalendarFields())
                .schemaVersion(ConfigLoader.schemaVersion())
                .build();
    }

    // --- Parsing helpers for the compact env formats ---

    /** "a, b ,c" -> [a, b, c] */
    public static List<String> parseList(String value) {
        List<String> items = new ArrayList<>();
        for (String part : value.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                items.add(trimmed);
            }
        }
        return items;
    }

    /** "aqi:1,3,6;pm2_5:1" -> [(aqi,[1,3,6]), (pm2_5,[1])] */
    public static List<HorizonSpec> parseHorizons(String value) {
        List<HorizonSpec> specs = new ArrayList<>();
        for (String entry : value.split(";")) {
            if (entry.trim().isEmpty()) {
                continue;
            }
            String[] parts = entry.split(":");
            if (parts.length != 2) {
                throw new IllegalArgumentException("Expected '<channel>:<n>[,<n>...]' but got: " + entry);
            }
            specs.add(new HorizonSpec(parts[0].trim(), parseInts(parts[1])));
        }
        return specs;
    }

    /** "co:3;pm2_5:3,24" -> windows with MEAN and STD */
    public static List<WindowSpec> parseWindows(String value) {
        List<WindowSpec> specs = new ArrayList<>();
        for (HorizonSpec spec : parseHorizons(value)) {
            specs.add(new WindowSpec(spec.getChannel(), spec.getSteps(),
                    EnumSet.of(Aggregate.MEAN, Aggregate.STD)));
        }
        return specs;
    }

    private static List<Integer> parseInts(String value) {
        List<Integer> ints = new ArrayList<>();
        for (String item : parseList(value)) {
            try {
                ints.add(Integer.parseInt(item));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Not an integer step: '" + item + "'", e);
            }
        }
        return ints;
    }

    // --- Defaults, restricted to configured channels ---

    private static List<HorizonSpec> defaultLags(List<String> channels) {
        List<HorizonSpec> lags = new ArrayList<>();
        for (String channel : List.of("aqi", "pm2_5", "pm10")) {
            if (channels.contains(channel)) {
                lags.add(new HorizonSpec(channel, List.of(1, 3, 6)));
            }
        }
        return lags;
    }

    private static List<WindowSpec> defaultWindows(List<String> channels) {
        List<WindowSpec> windows = new ArrayList<>();
        for (String channel : DEFAULT_POLLUTANTS) {
            if (channels.contains(channel)) {
                windows.add(new WindowSpec(channel, List.of(3), EnumSet.of(Aggregate.MEAN, Aggregate.STD)));
            }
        }
        return windows;
    }

    private static List<HorizonSpec> defaultTargets(List<String> channels) {
        if (channels.contains("aqi")) {
            return List.of(new HorizonSpec("aqi", List.of(1, 6)));
        }
        return Collections.emptyList();
    }

    private static List<RatioSpec> defaultRatios(List<String> channels) {
        List<RatioSpec> ratios = new ArrayList<>();
        if (channels.contains("pm2_5") && channels.contains("pm10")) {
            ratios.add(new RatioSpec("pm_ratio", "pm2_5", "pm10"));
        }
        if (channels.contains("no2") && channels.contains("o3")) {
            ratios.add(new RatioSpec("no2_to_o3_ratio", "no2", "o3"));
        }
        return ratios;
    }

    private static List<ProductSpec> defaultProducts(List<String> channels) {
        if (channels.contains("temperature") && channels.contains("humidity")) {
            return List.of(new ProductSpec("temp_humidity_index", "temperature", "humidity", 100.0));
        }
        return Collections.emptyList();
    }

    private void validate() {
        if (channels.isEmpty()) {
            throw new IllegalArgumentException("At least one channel must be configured");
        }
        if (new HashSet<>(channels).size() != channels.size()) {
            throw new IllegalArgumentException("Duplicate channel in " + channels);
        }
        for (HorizonSpec lag : lags) {
            requireChannel(lag.getChannel(), "lag");
            requireSteps(lag.getSteps(), 1, "lag horizon");
        }
        for (WindowSpec window : windows) {
            requireChannel(window.getChannel(), "rolling window");
            requireSteps(window.getSizes(), 2, "window size");
            if (window.getAggregates().isEmpty()) {
                throw new IllegalArgumentException("Window on " + window.getChannel() + " has no aggregates");
            }
        }
        for (HorizonSpec target : targets) {
            requireChannel(target.getChannel(), "target");
            requireSteps(target.getSteps(), 1, "target horizon");
        }
        for (RatioSpec ratio : ratios) {
            requireChannel(ratio.getNumerator(), "ratio " + ratio.getName());
            requireChannel(ratio.getDenominator(), "ratio " + ratio.getName());
        }
        for (ProductSpec product : products) {
            requireChannel(product.getLeft(), "product " + product.getName());
            requireChannel(product.getRight(), "product " + product.getName());
        }
        if (ratioEpsilon < 0 || Double.isNaN(ratioEpsilon)) {
            throw new IllegalArgumentException("Ratio epsilon must be >= 0, got " + ratioEpsilon);
        }
        if (Double.isNaN(imputeDefault) || Double.isInfinite(imputeDefault)) {
            throw new IllegalArgumentException("Impute default must be finite");
        }
        if (schemaVersion < 1) {
            throw new IllegalArgumentException("Schema version must be >= 1, got " + schemaVersion);
        }
    }

    private void requireChannel(String channel, String usage) {
        if (!channels.contains(channel)) {
            throw new IllegalArgumentException(String.format(
                    "%s references '%s' which is not a configured channel", usage, channel));
        }
    }

    private static void requireSteps(List<Integer> steps, int min, String what) {
        if (steps.isEmpty()) {
            throw new IllegalArgumentException("No " + what + " given");
        }
        for (int step : steps) {
            if (step < min) {
                throw new IllegalArgumentException(what + " must be >= " + min + ", got " + step);
            }
        }
    }

    // Getters
    public List<String> getChannels() { return channels; }
    public List<HorizonSpec> getLags() { return lags; }
    public List<WindowSpec> getWindows() { return windows; }
    public List<HorizonSpec> getTargets() { return targets; }
    public List<RatioSpec> getRatios() { return ratios; }
    public List<ProductSpec> getProducts() { return products; }
    public List<CalendarField> getCyclicFields() { return cyclicFields; }
    public boolean isRetainCalendarFields() { return retainCalendarFields; }
    public WindowPolicy getWindowPolicy() { return windowPolicy; }
    public double getRatioEpsilon() { return ratioEpsilon; }
    public double getImputeDefault() { return imputeDefault; }
    public int getSchemaVersion() { return schemaVersion; }

    @Override
    public String toString() {
        return String.format(
                "PipelineConfig{channels=%s, lags=%d, windows=%d, targets=%d, policy=%s, version=%d}",
                channels, lags.size(), windows.size(), targets.size(), windowPolicy, schemaVersion);
    }

    /**
     * Builder; anything left unset falls back to the Karachi defaults.
     */
    public static final class Builder {
        private List<String> channels = DEFAULT_CHANNELS;
        private List<HorizonSpec> lags;
        private List<WindowSpec> windows;
        private List<HorizonSpec> targets;
        private List<RatioSpec> ratios;
        private List<ProductSpec> products;
        private List<CalendarField> cyclicFields =
                Arrays.asList(CalendarField.HOUR, CalendarField.DAY_OF_WEEK, CalendarField.MONTH);
        private boolean retainCalendarFields = false;
        private WindowPolicy windowPolicy = WindowPolicy.FULL;
        private double ratioEpsilon = 1e-5;
        private double imputeDefault = 0.0;
        private int schemaVersion = 1;

        private Builder() {}

        public Builder channels(List<String> channels) { this.channels = channels; return this; }
        public Builder lags(List<HorizonSpec> lags) { this.lags = lags; return this; }
        public Builder windows(List<WindowSpec> windows) { this.windows = windows; return this; }
        public Builder targets(List<HorizonSpec> targets) { this.targets = targets; return this; }
        public Builder ratios(List<RatioSpec> ratios) { this.ratios = ratios; return this; }
        public Builder products(List<ProductSpec> products) { this.products = products; return this; }
        public Builder cyclicFields(List<CalendarField> fields) { this.cyclicFields = fields; return this; }
        public Builder retainCalendarFields(boolean retain) { this.retainCalendarFields = retain; return this; }
        public Builder windowPolicy(WindowPolicy policy) { this.windowPolicy = policy; return this; }
        public Builder ratioEpsilon(double epsilon) { this.ratioEpsilon = epsilon; return this; }
        public Builder imputeDefault(double value) { this.imputeDefault = value; return this; }
        public Builder schemaVersion(int version) { this.schemaVersion = version; return this; }

        public PipelineConfig build() {
            return new PipelineConfig(this);
        }
    }

    /**
     * A channel and a list of positional steps (lag horizons or target horizons).
     */
    public static final class HorizonSpec {
        private final String channel;
        private final List<Integer> steps;

        public HorizonSpec(String channel, List<Integer> steps) {
            this.channel = channel;
            this.steps = List.copyOf(new LinkedHashSet<>(steps));
        }

        public String getChannel() { return channel; }
        public List<Integer> getSteps() { return steps; }
    }

    public static final class WindowSpec {
        private final String channel;
        private final List<Integer> sizes;
        private final Set<Aggregate> aggregates;

        public WindowSpec(String channel, List<Integer> sizes, Set<Aggregate> aggregates) {
            this.channel = channel;
            this.sizes = List.copyOf(new LinkedHashSet<>(sizes));
            this.aggregates = aggregates.isEmpty()
                    ? Collections.emptySet()
                    : Collections.unmodifiableSet(EnumSet.copyOf(aggregates));
        }

        public String getChannel() { return channel; }
        public List<Integer> getSizes() { return sizes; }
        public Set<Aggregate> getAggregates() { return aggregates; }
    }

    /** numerator / (denominator + epsilon) */
    public static final class RatioSpec {
        private final String name;
        private final String numerator;
        private final String denominator;

        public RatioSpec(String name, String numerator, String denominator) {
            this.name = name;
            this.numerator = numerator;
            this.denominator = denominator;
        }

        public String getName() { return name; }
        public String getNumerator() { return numerator; }
        public String getDenominator() { return denominator; }
    }

    /** left * right / divisor */
    public static final class ProductSpec {
        private final String name;
        private final String left;
        private final String right;
        private final double divisor;

        public ProductSpec(String name, String left, String right, double divisor) {
            if (divisor == 0.0) {
                throw new IllegalArgumentException("Product " + name + " has a zero divisor");
            }
            this.name = name;
            this.left = left;
            this.right = right;
            this.divisor = divisor;
        }

        public String getName() { return name; }
        public String getLeft() { return left; }
        public String getRight() { return right; }
        public double getDivisor() { return divisor; }
    }
}
