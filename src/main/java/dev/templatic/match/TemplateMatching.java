package dev.templatic.match;

import dev.templatic.match.math.MatchMath;
import dev.templatic.match.math.ops.IntensityScale;
import dev.templatic.match.math.ops.MatrixShape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Similarity scores between a search space and a template of the same shape,
 * modelled on the template matching modes OpenCV documents.
 * 
 * <p><b>Auto-normalization:</b> before scoring, any operand whose maximum
 * element exceeds 1.0 is taken to hold 8-bit intensities and is divided by
 * 255 <em>in place</em>. The caller's arrays are therefore rescaled after the
 * call. Each operand is checked on its own, so one may be rescaled while the
 * other is not. Pass {@link MatchMath#copyOf(double[][])} copies to keep the
 * originals intact.
 * 
 * <p><b>Score direction:</b> higher is more similar for the cross correlation
 * and correlation coefficient scores; lower is more similar for
 * {@link #sqDiff} and {@link #normedSqDiff}, where 0 means identical.
 * 
 * <p>All methods throw {@link IllegalArgumentException} when the two
 * matrices differ in shape, before touching either one. Zero norms are not
 * guarded and yield NaN or infinity.
 * 
 * <p><b>Usage:</b>
 * <pre>{@code
 * double[][] window = ...;   // raw 0..255 pixels
 * double[][] template = ...;
 * double score = TemplateMatching.normedCrossCorrelation(window, template);
 * String shown = TemplateMatchingAlgorithm.CCORR_NORMED + ": "
 *         + MatchMath.roundDecimal(score, PrecisionRoundingRule.THREES);
 * }</pre>
 */
public final class TemplateMatching {
    
    private static final Logger log = LoggerFactory.getLogger(TemplateMatching.class);
    
    /**
     * Normed cross correlation: crossCorrelation / (norm(searchSpace) * norm(template)).
     * 
     * @param searchSpace region of the image being checked, may be rescaled in place
     * @param template pattern to match, may be rescaled in place
     * @return similarity in [-1, 1], 1 for identical matrices
     */
    public static double normedCrossCorrelation(double[][] searchSpace, double[][] template) {
        double elemMulSum = crossCorrelation(searchSpace, template);
        double normSearchSpace = MatchMath.norm(searchSpace);
        double normTemplate = MatchMath.norm(template);
        
        double score = elemMulSum / (normSearchSpace * normTemplate);
        log.trace("normedCrossCorrelation={}", score);
        return score;
    }
    
    /**
     * Cross correlation: sum(searchSpace * template) over all elements.
     * 
     * @param searchSpace region of the image being checked, may be rescaled in place
     * @param template pattern to match, may be rescaled in place
     * @return unbounded similarity, higher is more similar
     */
    public static double crossCorrelation(double[][] searchSpace, double[][] template) {
        prepare(searchSpace, template);
        
        double score = MatchMath.sumAll(MatchMath.multiplyElementwise(searchSpace, template));
        log.trace("crossCorrelation={}", score);
        return score;
    }
    
    /**
     * Correlation coefficient: the cross correlation of both operands after
     * subtracting their means.
     * 
     * <p>The centered copies go through {@link #crossCorrelation} and so are
     * checked and auto-normalized a second time. For data already in [0, 1]
     * that second pass never rescales.
     * 
     * @param searchSpace region of the image being checked, may be rescaled in place
     * @param template pattern to match, may be rescaled in place
     * @return unbounded similarity, higher is more similar
     */
    public static double corrCoef(double[][] searchSpace, double[][] template) {
        prepare(searchSpace, template);
        
        double[][] meanDiffSearchSpace = MatchMath.meanCentered(searchSpace);
        double[][] meanDiffTemplate = MatchMath.meanCentered(template);
        
        return crossCorrelation(meanDiffSearchSpace, meanDiffTemplate);
    }
    
    /**
     * Normed correlation coefficient: corrCoef divided by the norms of the
     * mean-centered operands.
     * 
     * @param searchSpace region of the image being checked, may be rescaled in place
     * @param template pattern to match, may be rescaled in place
     * @return similarity in [-1, 1]
     */
    public static double normedCorrCoef(double[][] searchSpace, double[][] template) {
        double elementMul = corrCoef(searchSpace, template);
        double normMeanDiffSearchSpace = MatchMath.norm(MatchMath.meanCentered(searchSpace));
        double normMeanDiffTemplate = MatchMath.norm(MatchMath.meanCentered(template));
        
        double score = elementMul / (normMeanDiffTemplate * normMeanDiffSearchSpace);
        log.trace("normedCorrCoef={}", score);
        return score;
    }
    
    /**
     * Squared difference: sum((searchSpace - template)^2) over all elements.
     * 
     * @param searchSpace region of the image being checked, may be rescaled in place
     * @param template pattern to match, may be rescaled in place
     * @return non-negative distance, 0 for identical matrices, lower is more similar
     */
    public static double sqDiff(double[][] searchSpace, double[][] template) {
        prepare(searchSpace, template);
        
        double score = MatchMath.squaredDifference(searchSpace, template);
        log.trace("sqDiff={}", score);
        return score;
    }
    
    /**
     * Normed squared difference: sqDiff / (norm(searchSpace) * norm(template)).
     * 
     * @param searchSpace region of the image being checked, may be rescaled in place
     * @param template pattern to match, may be rescaled in place
     * @return non-negative distance, lower is more similar
     */
    public static double normedSqDiff(double[][] searchSpace, double[][] template) {
        double sqDiffScore = sqDiff(searchSpace, template);
        double normSearchSpace = MatchMath.norm(searchSpace);
        double normTemplate = MatchMath.norm(template);
        
        double score = sqDiffScore / (normSearchSpace * normTemplate);
        log.trace("normedSqDiff={}", score);
        return score;
    }
    
    /**
     * Shape check followed by per-operand auto-normalization.
     */
    private static void prepare(double[][] searchSpace, double[][] template) {
        MatrixShape.requireSameShape(searchSpace, template);
        
        if (IntensityScale.autoNormalizeInPlace(searchSpace))
            log.debug("Search space max exceeds {}, rescaled by {}",
                    IntensityScale.AUTO_NORMALIZE_THRESHOLD, IntensityScale.INTENSITY_RANGE);
        if (IntensityScale.autoNormalizeInPlace(template))
            log.debug("Template max exceeds {}, rescaled by {}",
                    IntensityScale.AUTO_NORMALIZE_THRESHOLD, IntensityScale.INTENSITY_RANGE);
    }
    
    private TemplateMatching() {}
}
