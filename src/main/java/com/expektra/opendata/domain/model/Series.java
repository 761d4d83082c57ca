package com.expektra.opendata.domain.model;

import com.expektra.opendata.domain.exception.InvalidRangeException;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import static com.expektra.opendata.domain.model.SeriesField.of;

/**
 * The eSett datasets served through the cache.
 * Each series has a fixed schema, a native granularity and its own storage table.
 */
public enum Series {

    PRODUCTION("production", Duration.ofHours(1), "production", List.of(
            of("total", "total"),
            of("hydro", "hydro"),
            of("wind", "wind"),
            of("wind_offshore", "windOffshore"),
            of("solar", "solar"),
            of("nuclear", "nuclear"),
            of("thermal", "thermal"),
            of("energy_storage", "energyStorage"),
            of("other", "other"))),

    CONSUMPTION("consumption", Duration.ofHours(1), "consumption", List.of(
            of("total", "total"),
            of("metered", "metered"),
            of("profiled", "profiled"),
            of("flex", "flex"))),

    PRICES("prices", Duration.ofHours(1), "imbalance_price", List.of(
            of("up_reg_price", "upRegPrice"),
            of("down_reg_price", "downRegPrice"),
            of("imbl_purchase_price", "imblPurchasePrice"),
            of("imbl_sales_price", "imblSalesPrice"),
            of("imbl_spot_difference_price", "imblSpotDifferencePrice"),
            of("incentivising_component", "incentivisingComponent"),
            of("main_dir_reg_power_per_mba", "mainDirRegPowerPerMBA"),
            of("value_of_avoided_activation", "valueOfAvoidedActivation"),
            of("up_reg_price_frr_a", "upRegPriceFrrA"),
            of("down_reg_price_frr_a", "downRegPriceFrrA"))),

    LOAD_PROFILE("load-profile", Duration.ofMinutes(15), "load_profile", List.of(
            of("quantity", "quantity")));

    private final String slug;
    private final Duration granularity;
    private final String table;
    private final List<SeriesField> fields;

    Series(String slug, Duration granularity, String table, List<SeriesField> fields) {
        this.slug = slug;
        this.granularity = granularity;
        this.table = table;
        this.fields = fields;
    }

    /**
     * URL segment of the series endpoint, e.g. {@code load-profile}.
     */
    public String slug() {
        return slug;
    }

    public Duration granularity() {
        return granularity;
    }

    /**
     * True for series that eSett also publishes per metering grid area.
     */
    public boolean hasMeteringGridAreas() {
        return this == LOAD_PROFILE;
    }

    public String table() {
        return table;
    }

    public List<SeriesField> fields() {
        return fields;
    }

    public List<String> fieldNames() {
        return fields.stream().map(SeriesField::name).toList();
    }

    public static Series fromSlug(String slug) {
        return Arrays.stream(values())
                .filter(series -> series.slug.equalsIgnoreCase(slug) || series.name().equalsIgnoreCase(slug))
                .findFirst()
                .orElseThrow(() -> new InvalidRangeException("Unknown series: " + slug));
    }
}
