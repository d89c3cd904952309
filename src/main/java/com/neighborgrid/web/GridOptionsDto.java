package com.neighborgrid.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.neighborgrid.grid.GridOptions;
import com.neighborgrid.grid.Origin;
import java.util.Locale;

public record GridOptionsDto(
        String origin,
        @JsonProperty("inverted_y")
        Boolean invertedY,
        @JsonProperty("neighbor_ybased")
        Boolean neighborYBased,
        @JsonProperty("wrap_x")
        Boolean wrapX,
        @JsonProperty("wrap_y")
        Boolean wrapY
) {

    /**
     * Fills unset fields from {@code base}. Origins are accepted by enum name ({@code lower_left})
     * or short code ({@code LL}).
     */
    public GridOptions toOptions(GridOptions base) {
        GridOptions.Builder builder = base.toBuilder();
        if (origin != null && !origin.isBlank()) {
            builder.origin(parseOrigin(origin));
        }
        if (invertedY != null) {
            builder.invertedY(invertedY);
        }
        if (neighborYBased != null) {
            builder.neighborYBased(neighborYBased);
        }
        if (wrapX != null) {
            builder.wrapX(wrapX);
        }
        if (wrapY != null) {
            builder.wrapY(wrapY);
        }
        return builder.build();
    }

    private static Origin parseOrigin(String raw) {
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return Origin.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            return Origin.fromCode(normalized);
        }
    }
}
