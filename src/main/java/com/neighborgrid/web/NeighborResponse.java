package com.neighborgrid.web;

import com.fasterxml.jackson.annotation.JsonProperty;

public record NeighborResponse(
        int value,
        int offset,
        Integer quadrant,
        @JsonProperty("up_left")
        Integer upLeft,
        Integer up,
        @JsonProperty("up_right")
        Integer upRight,
        Integer left,
        Integer right,
        @JsonProperty("down_left")
        Integer downLeft,
        Integer down,
        @JsonProperty("down_right")
        Integer downRight,
        String options
) {
}
