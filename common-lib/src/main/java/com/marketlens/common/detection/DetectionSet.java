package com.marketlens.common.detection;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The seven capped detector outputs of one invocation, each list oldest-first.
 * Lists are copied on construction and unmodifiable.
 */
public record DetectionSet(
    @JsonProperty("order_blocks") List<OrderBlock> orderBlocks,
    @JsonProperty("fair_value_gaps") List<FairValueGap> fairValueGaps,
    @JsonProperty("break_of_structure") List<BreakOfStructure> breakOfStructure,
    @JsonProperty("change_of_character") List<ChangeOfCharacter> changeOfCharacter,
    @JsonProperty("liquidity_zones") List<LiquidityZone> liquidityZones,
    @JsonProperty("anchored_vwap") List<AnchoredVwap> anchoredVwap,
    @JsonProperty("rsi_divergence") List<RsiDivergence> rsiDivergence
) {
    public DetectionSet {
        orderBlocks       = copy(orderBlocks);
        fairValueGaps     = copy(fairValueGaps);
        breakOfStructure  = copy(breakOfStructure);
        changeOfCharacter = copy(changeOfCharacter);
        liquidityZones    = copy(liquidityZones);
        anchoredVwap      = copy(anchoredVwap);
        rsiDivergence     = copy(rsiDivergence);
    }

    public static DetectionSet empty() {
        return new DetectionSet(List.of(), List.of(), List.of(), List.of(), List.of(), List.of(), List.of());
    }

    private static <T> List<T> copy(List<T> list) {
        return list == null ? List.of() : List.copyOf(list);
    }
}
