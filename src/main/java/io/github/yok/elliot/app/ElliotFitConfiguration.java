package io.github.yok.elliot.app;

import io.github.yok.elliot.core.baseline.BaselineEstimator;
import io.github.yok.elliot.core.baseline.BaselineMode;
import io.github.yok.elliot.core.linearalgebra.EjmlLeastSquaresBackend;
import io.github.yok.elliot.core.linearalgebra.LeastSquaresBackend;
import io.github.yok.elliot.core.metrics.DerivedMetricsCalculator;
import io.github.yok.elliot.core.model.ElliotSpectralModel;
import io.github.yok.elliot.core.model.FitParameter;
import io.github.yok.elliot.core.model.FittingParameters;
import io.github.yok.elliot.core.model.SpectralModel;
import io.github.yok.elliot.core.pipeline.DatasetFitPipeline;
import io.github.yok.elliot.core.pipeline.DatasetOrchestrator;
import io.github.yok.elliot.core.pipeline.FitSettings;
import io.github.yok.elliot.core.range.ParameterBounds;
import io.github.yok.elliot.core.range.RangeSelector;
import io.github.yok.elliot.core.solver.BoundedLeastSquaresOptimizer;
import io.github.yok.elliot.core.solver.SpectrumOptimizer;
import io.github.yok.elliot.core.solver.StagedFitProcedure;
import io.github.yok.elliot.core.spectrum.EnergyRange;
import io.github.yok.elliot.in.SpectrumTableReader;
import io.github.yok.elliot.out.CsvResultWriter;
import io.github.yok.elliot.out.ResultWriter;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Elliot モデルのフィッティング一式の Bean 定義を行う設定クラスです。
 *
 * <p>
 * 設定値（elliot.*）を不変の {@link FitSettings} に変換し、コア側には Spring の型を渡しません。
 * </p>
 */
@Configuration
@RequiredArgsConstructor
public class ElliotFitConfiguration {

    /**
     * 積分ノード数とノード密度 NS の比です。
     */
    private static final int NODES_PER_NS = 10;

    /**
     * elliot-fitter の設定値（elliot.*）です。
     */
    private final ElliotProperties p;

    /**
     * Elliot モデルを生成します。
     *
     * @return スペクトルモデルです
     */
    @Bean
    public SpectralModel spectralModel() {
        ElliotProperties.Fit f = p.getFit();
        return new ElliotSpectralModel(f.getSeriesTerms(), NODES_PER_NS * f.getNs());
    }

    /**
     * 線形最小二乗のバックエンドを生成します。
     *
     * @return バックエンドです
     */
    @Bean
    public LeastSquaresBackend leastSquaresBackend() {
        return new EjmlLeastSquaresBackend();
    }

    /**
     * ベースライン推定ロジックを生成します。
     *
     * @param leastSquares 線形最小二乗のバックエンドです
     * @return ベースライン推定ロジックです
     */
    @Bean
    public BaselineEstimator baselineEstimator(LeastSquaresBackend leastSquares) {
        return new BaselineEstimator(leastSquares);
    }

    /**
     * 範囲選択ロジックを生成します。
     *
     * @return 範囲選択ロジックです
     */
    @Bean
    public RangeSelector rangeSelector() {
        return new RangeSelector();
    }

    /**
     * 箱型制約付きの最適化器を生成します。
     *
     * @param model スペクトルモデルです
     * @return 最適化器です
     */
    @Bean
    public SpectrumOptimizer spectrumOptimizer(SpectralModel model) {
        ElliotProperties.Fit f = p.getFit();
        return new BoundedLeastSquaresOptimizer(model, f.getMaxIterations(),
                f.getMaxEvaluations(), f.getCostTolerance(), f.getParameterTolerance());
    }

    /**
     * 段階的フィッティングを生成します。
     *
     * @param optimizer 最適化器です
     * @param rangeSelector 範囲選択ロジックです
     * @return 段階的フィッティングです
     */
    @Bean
    public StagedFitProcedure stagedFitProcedure(SpectrumOptimizer optimizer,
            RangeSelector rangeSelector) {
        return new StagedFitProcedure(optimizer, rangeSelector,
                p.getFit().getSaturationEpsilon(), StagedFitProcedure.DEFAULT_MINIMUM_FIT_POINTS);
    }

    /**
     * 派生量の計算ロジックを生成します。
     *
     * @param leastSquares 線形最小二乗のバックエンドです
     * @return 計算ロジックです
     */
    @Bean
    public DerivedMetricsCalculator derivedMetricsCalculator(LeastSquaresBackend leastSquares) {
        return new DerivedMetricsCalculator(leastSquares, p.getFit().getGroundStateEpsilon(),
                DerivedMetricsCalculator.DEFAULT_MINIMUM_URBACH_POINTS);
    }

    /**
     * 1 データセットの解析ロジックを生成します。
     *
     * @param baselineEstimator ベースライン推定ロジックです
     * @param rangeSelector 範囲選択ロジックです
     * @param stagedFitProcedure 段階的フィッティングです
     * @param model スペクトルモデルです
     * @param metricsCalculator 派生量の計算ロジックです
     * @return 解析ロジックです
     */
    @Bean
    public DatasetFitPipeline datasetFitPipeline(BaselineEstimator baselineEstimator,
            RangeSelector rangeSelector, StagedFitProcedure stagedFitProcedure,
            SpectralModel model, DerivedMetricsCalculator metricsCalculator) {
        return new DatasetFitPipeline(baselineEstimator, rangeSelector, stagedFitProcedure, model,
                metricsCalculator);
    }

    /**
     * 全データセットの解析ロジックを生成します。
     *
     * @param pipeline 1 データセットの解析ロジックです
     * @return 解析ロジックです
     */
    @Bean
    public DatasetOrchestrator datasetOrchestrator(DatasetFitPipeline pipeline) {
        return new DatasetOrchestrator(pipeline);
    }

    /**
     * 設定値から解析設定を生成します。
     *
     * @return 解析設定です
     * @throws IllegalStateException 設定値が不正な場合に発生します
     */
    @Bean
    public FitSettings fitSettings() {
        ElliotProperties.Baseline b = p.getBaseline();
        ElliotProperties.Fit f = p.getFit();
        ElliotProperties.StartPoint s = p.getStartPoint();

        BaselineMode mode = BaselineMode.fromFitmode(b.getFitmode());
        EnergyRange baselineRange = toRange("baseline", b.getLower(), b.getUpper());
        if (mode != BaselineMode.NONE && baselineRange == null) {
            throw new IllegalStateException(
                    "baseline.lower/upper は fitmode=" + b.getFitmode() + " では必須です");
        }

        // Eg は初期 Eg の決定後に置き換えるため、ここでは既定値を入れておきます。
        double eg = s.getEg() != null ? s.getEg() : FittingParameters.defaults().getEg();
        FittingParameters start = new FittingParameters(eg, s.getEb(), s.getGamma(),
                s.getUcvsq(), s.getMhcnp(), s.getQ());

        return FitSettings.builder().baselineMode(mode).baselineRange(baselineRange)
                .fitRange(toRange("fit", f.getLower(), f.getUpper()))
                .autoRangeEnabled(f.isAutoRange()).preliminaryEnabled(f.isPreliminary())
                .warmStart(f.isWarmStart()).deltaE(f.getDeltaE())
                .initialEg(s.getEg()).startPoint(start).bounds(bounds())
                .parallelism(f.getParallelism()).build();
    }

    /**
     * スペクトル表の読み込みロジックを生成します。
     *
     * @return 読み込みロジックです
     */
    @Bean
    public SpectrumTableReader spectrumTableReader() {
        return new SpectrumTableReader(p.getInput().isWavelength());
    }

    /**
     * 結果出力ロジックを生成します。
     *
     * @return 結果出力ロジックです
     */
    @Bean
    public ResultWriter resultWriter() {
        return new CsvResultWriter(p.getOutput().getDir());
    }

    /**
     * 既定の境界に上書き設定を反映します。
     */
    private ParameterBounds bounds() {
        ElliotProperties.Bounds o = p.getBounds();
        ParameterBounds bounds = ParameterBounds.defaults();
        bounds = override(bounds, FitParameter.EB, o.getEb());
        bounds = override(bounds, FitParameter.GAMMA, o.getGamma());
        bounds = override(bounds, FitParameter.UCVSQ, o.getUcvsq());
        bounds = override(bounds, FitParameter.MHCNP, o.getMhcnp());
        return override(bounds, FitParameter.Q, o.getQ());
    }

    private static ParameterBounds override(ParameterBounds bounds, FitParameter parameter,
            ElliotProperties.Range range) {
        if (range == null) {
            return bounds;
        }
        try {
            return bounds.with(parameter, range.getLower(), range.getUpper());
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("bounds の設定が不正です: " + parameter.getLabel(), e);
        }
    }

    private static EnergyRange toRange(String section, Double lower, Double upper) {
        if (lower == null && upper == null) {
            return null;
        }
        if (lower == null || upper == null) {
            throw new IllegalStateException(section + ".lower と " + section + ".upper は両方指定してください");
        }
        return EnergyRange.of(lower, upper);
    }
}
