package com.marketlens.analysis.detector;

import java.util.List;

/**
 * Static registry of the seven structural-pattern detectors. Instances are stateless and
 * shared by every request.
 */
public final class PatternDetectors {

    public static final OrderBlockDetector        ORDER_BLOCKS        = new OrderBlockDetector();
    public static final FairValueGapDetector      FAIR_VALUE_GAPS     = new FairValueGapDetector();
    public static final BreakOfStructureDetector  BREAK_OF_STRUCTURE  = new BreakOfStructureDetector();
    public static final ChangeOfCharacterDetector CHANGE_OF_CHARACTER = new ChangeOfCharacterDetector();
    public static final LiquidityZoneDetector     LIQUIDITY_ZONES     = new LiquidityZoneDetector();
    public static final AnchoredVwapDetector      ANCHORED_VWAP       = new AnchoredVwapDetector();
    public static final RsiDivergenceDetector     RSI_DIVERGENCE      = new RsiDivergenceDetector();

    private static final List<PatternDetector<?>> ALL = List.of(
        ORDER_BLOCKS,
        FAIR_VALUE_GAPS,
        BREAK_OF_STRUCTURE,
        CHANGE_OF_CHARACTER,
        LIQUIDITY_ZONES,
        ANCHORED_VWAP,
        RSI_DIVERGENCE
    );

    private PatternDetectors() {}

    public static List<PatternDetector<?>> all() {
        return ALL;
    }
}
