package io.github.yok.elliot.core.range;

import io.github.yok.elliot.core.model.FitParameter;
import io.github.yok.elliot.core.spectrum.EnergyRange;
import io.github.yok.elliot.core.spectrum.Spectrum;
import java.util.Locale;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * ベースライン除去後のスペクトルからバンドギャップの初期値を求め、 Eg の動的な境界とバンドギャップ近傍の絞り込み範囲を決めるクラスです。
 *
 * <p>
 * 初期 Eg の決定は、利用者指定値と自動検出値の両方を受け取る明示的な判定関数 {@link #chooseInitialBandGap(Double, double, EnergyRange)}
 * で行います。
 * </p>
 */
@Slf4j
@Getter
public final class RangeSelector {

    /**
     * 閾値を決める最大吸収値に対する比率の既定値です。
     */
    public static final double DEFAULT_THRESHOLD_FRACTION = 0.05;

    /**
     * 閾値の下限の既定値です。
     */
    public static final double DEFAULT_MINIMUM_THRESHOLD = 0.1;

    /**
     * Eg 境界の半幅の既定値（eV）です。
     */
    public static final double DEFAULT_EG_BOUND_HALF_WIDTH = 0.4;

    /**
     * バンドギャップ近傍フィッティングの半幅の既定値（eV）です。
     */
    public static final double DEFAULT_FOCUS_HALF_WIDTH = 0.5;

    /**
     * 閾値を決める最大吸収値に対する比率です。
     */
    private final double thresholdFraction;

    /**
     * 閾値の下限です。
     */
    private final double minimumThreshold;

    /**
     * Eg 境界の半幅（eV）です。
     */
    private final double egBoundHalfWidth;

    /**
     * バンドギャップ近傍フィッティングの半幅（eV）です。
     */
    private final double focusHalfWidth;

    /**
     * 既定値で生成します。
     */
    public RangeSelector() {
        this(DEFAULT_THRESHOLD_FRACTION, DEFAULT_MINIMUM_THRESHOLD, DEFAULT_EG_BOUND_HALF_WIDTH,
                DEFAULT_FOCUS_HALF_WIDTH);
    }

    /**
     * 生成します。
     *
     * @param thresholdFraction 最大吸収値に対する閾値の比率です（(0, 1]）
     * @param minimumThreshold 閾値の下限です（0 以上）
     * @param egBoundHalfWidth Eg 境界の半幅です（正の値）
     * @param focusHalfWidth 近傍フィッティングの半幅です（正の値）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public RangeSelector(double thresholdFraction, double minimumThreshold,
            double egBoundHalfWidth, double focusHalfWidth) {
        if (!(thresholdFraction > 0.0 && thresholdFraction <= 1.0)) {
            throw new IllegalArgumentException("thresholdFraction は (0, 1] が必要です: " + thresholdFraction);
        }
        if (!(minimumThreshold >= 0.0)) {
            throw new IllegalArgumentException("minimumThreshold は 0 以上が必要です: " + minimumThreshold);
        }
        if (!(egBoundHalfWidth > 0.0)) {
            throw new IllegalArgumentException("egBoundHalfWidth は正の値が必要です: " + egBoundHalfWidth);
        }
        if (!(focusHalfWidth > 0.0)) {
            throw new IllegalArgumentException("focusHalfWidth は正の値が必要です: " + focusHalfWidth);
        }
        this.thresholdFraction = thresholdFraction;
        this.minimumThreshold = minimumThreshold;
        this.egBoundHalfWidth = egBoundHalfWidth;
        this.focusHalfWidth = focusHalfWidth;
    }

    /**
     * 吸収値が閾値 {@code max(minimumThreshold, fraction · max α)} を最初に超えるエネルギーを、 エネルギー昇順に 1 回走査して返します。
     *
     * <p>
     * 超える点がない場合はエネルギー軸の中央値を返します。
     * </p>
     *
     * @param cleaned ベースライン除去後のスペクトルです（空不可）
     * @return バンドギャップの推定値（eV）です
     * @throws IllegalArgumentException スペクトルが null または空の場合に発生します
     */
    public double detectBandGap(Spectrum cleaned) {
        if (cleaned == null || cleaned.isEmpty()) {
            throw new IllegalArgumentException("cleaned は空でないスペクトルが必要です");
        }
        double threshold = Math.max(minimumThreshold, thresholdFraction * cleaned.maxAbsorption());
        for (int i = 0; i < cleaned.size(); i++) {
            if (cleaned.absorptionAt(i) > threshold) {
                return cleaned.energyAt(i);
            }
        }
        double median = cleaned.medianEnergy();
        log.debug("閾値を超える点がないため中央値を初期 Eg とします。閾値={}、Eg={}", fmt3(threshold), fmt3(median));
        return median;
    }

    /**
     * 初期 Eg として用いる値を決めます。
     *
     * <p>
     * 利用者指定値が正の有限値で、かつ妥当範囲内にある場合はそれを優先し、そうでなければ自動検出値を返します。
     * </p>
     *
     * @param userEg 利用者指定の Eg です（未指定は null）
     * @param detectedEg 自動検出した Eg です
     * @param plausibleWindow 妥当範囲です（通常はスペクトルのエネルギー範囲）
     * @return 採用する初期 Eg です
     */
    public double chooseInitialBandGap(Double userEg, double detectedEg,
            EnergyRange plausibleWindow) {
        if (plausibleWindow == null) {
            throw new IllegalArgumentException("plausibleWindow は null 不可です");
        }
        if (userEg != null && Double.isFinite(userEg) && userEg > 0.0
                && plausibleWindow.contains(userEg)) {
            log.info("利用者指定の初期 Eg を使用します。Eg={} eV", fmt3(userEg));
            return userEg;
        }
        log.info("データから求めた初期 Eg を使用します。Eg={} eV（指定値={}）", fmt3(detectedEg), userEg);
        return detectedEg;
    }

    /**
     * 初期 Eg から Eg の境界 [Eg - 0.4, Eg + 0.4] を求め、他のパラメータは既定の境界を用います。
     *
     * <p>
     * 求めた区間が空になる場合は ±0.5 eV に広げます。
     * </p>
     *
     * @param initialEg 初期 Eg（eV）です
     * @param defaults Eg 以外のパラメータに用いる境界です
     * @return 境界です
     */
    public ParameterBounds computeBounds(double initialEg, ParameterBounds defaults) {
        if (!Double.isFinite(initialEg)) {
            throw new IllegalArgumentException("initialEg は有限値が必要です: " + initialEg);
        }
        if (defaults == null) {
            throw new IllegalArgumentException("defaults は null 不可です");
        }
        double lo = initialEg - egBoundHalfWidth;
        double hi = initialEg + egBoundHalfWidth;
        if (!(lo < hi)) {
            lo = initialEg - DEFAULT_FOCUS_HALF_WIDTH;
            hi = initialEg + DEFAULT_FOCUS_HALF_WIDTH;
        }
        ParameterBounds bounds = defaults.with(FitParameter.EG, lo, hi);
        log.info("Eg の境界を設定しました。[{}, {}] eV（初期値 ±{} eV）", fmt3(lo), fmt3(hi),
                fmt3(egBoundHalfWidth));
        return bounds;
    }

    /**
     * バンドギャップ近傍の区間 [Eg - 0.5, Eg + 0.5] を返します。
     *
     * @param eg バンドギャップ（eV）です
     * @return 区間です
     */
    public EnergyRange focusWindow(double eg) {
        return EnergyRange.around(eg, focusHalfWidth);
    }

    /**
     * スペクトルをバンドギャップ近傍 [Eg - 0.5, Eg + 0.5] に絞り込みます。
     *
     * @param spectrum 対象スペクトルです
     * @param eg バンドギャップ（eV）です
     * @return 絞り込んだ新しいスペクトルです
     */
    public Spectrum narrowRange(Spectrum spectrum, double eg) {
        if (spectrum == null) {
            throw new IllegalArgumentException("spectrum は null 不可です");
        }
        return spectrum.restrict(focusWindow(eg));
    }

    private static String fmt3(double v) {
        return String.format(Locale.ROOT, "%.3f", v);
    }
}
