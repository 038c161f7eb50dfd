package io.github.yok.elliot.app;

import java.util.List;
import javax.validation.Valid;
import javax.validation.constraints.Max;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.Positive;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * elliot-fitter の設定値（elliot.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、CLI 実行時の初期化に使用します。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "elliot")
public class ElliotProperties {

    /**
     * 入力設定です。
     */
    @Valid
    private Input input = new Input();

    /**
     * ベースライン設定です。
     */
    @Valid
    private Baseline baseline = new Baseline();

    /**
     * フィッティング設定です。
     */
    @Valid
    private Fit fit = new Fit();

    /**
     * 初期パラメータです。
     */
    private StartPoint startPoint = new StartPoint();

    /**
     * 境界の上書き設定です。
     */
    private Bounds bounds = new Bounds();

    /**
     * 出力設定です。
     */
    @Valid
    private Output output = new Output();

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "elliot")
    public String toMultilineString() {
        String nl = System.lineSeparator();

        Input i = getInput();
        Baseline b = getBaseline();
        Fit f = getFit();
        StartPoint s = getStartPoint();
        Bounds bd = getBounds();
        Output o = getOutput();

        // 先頭改行を入れて、ログの可読性を上げます。
        StringBuilder sb = new StringBuilder(256).append(nl);

        appendSection(sb, nl, "input",
                // file: 入力ファイル
                "file", i.getFile(),
                // wavelength: 1 列目が波長（nm）かどうか
                "wavelength", i.isWavelength(),
                // datasets: 1 始まりのデータセット番号（空はすべて）
                "datasets", i.getDatasets());

        appendSection(sb, nl, "baseline",
                // fitmode: 0=なし, 1=1次式, 2=E^4
                "fitmode", b.getFitmode(),
                // lower/upper: 当てはめ範囲（eV）
                "lower", b.getLower(), "upper", b.getUpper());

        appendSection(sb, nl, "fit",
                // lower/upper: フィッティング範囲（eV、未指定は全範囲）
                "lower", f.getLower(), "upper", f.getUpper(),
                // autoRange: バンドギャップ近傍フィッティングを行うかどうか
                "autoRange", f.isAutoRange(),
                // preliminary: 予備フィットを行うかどうか
                "preliminary", f.isPreliminary(),
                // warmStart: 直前のデータセットの結果を初期値に使うかどうか
                "warmStart", f.isWarmStart(),
                // deltaE: 規格化オフセット
                "deltaE", f.getDeltaE(),
                // ns: ノード密度（積分ノード数 = 10 * ns）
                "ns", f.getNs(),
                // seriesTerms: 励起子級数の項数
                "seriesTerms", f.getSeriesTerms(),
                // maxIterations/maxEvaluations: 最適化の上限
                "maxIterations", f.getMaxIterations(), "maxEvaluations", f.getMaxEvaluations(),
                // costTolerance/parameterTolerance: 収束判定の相対許容誤差
                "costTolerance", f.getCostTolerance(),
                "parameterTolerance", f.getParameterTolerance(),
                // saturationEpsilon: 境界張り付き判定の相対幅
                "saturationEpsilon", f.getSaturationEpsilon(),
                // groundStateEpsilon: q が 1 に近いと判定する幅（|1-q| 以下で Eb_GroundState を求めない）
                "groundStateEpsilon", f.getGroundStateEpsilon(),
                // parallelism: 並列実行のスレッド数
                "parallelism", f.getParallelism());

        appendSection(sb, nl, "startPoint",
                "eg", s.getEg(), "eb", s.getEb(), "gamma", s.getGamma(), "ucvsq", s.getUcvsq(),
                "mhcnp", s.getMhcnp(), "q", s.getQ());

        appendSection(sb, nl, "bounds",
                "eb", bd.getEb(), "gamma", bd.getGamma(), "ucvsq", bd.getUcvsq(),
                "mhcnp", bd.getMhcnp(), "q", bd.getQ());

        appendSection(sb, nl, "output",
                // dir: 出力先ディレクトリ
                "dir", o.getDir());

        return sb.toString();
    }

    /**
     * セクション名と (key, value) ペア列を、YAML 風の複数行テキストとして追記します。
     *
     * <pre>
     *   section:
     *     key: value
     * </pre>
     *
     * @param sb 追記先バッファです
     * @param nl 改行文字列です
     * @param section セクション名です
     * @param kvPairs key1, value1, key2, value2, ... の順で渡すペア列です
     */
    private static void appendSection(StringBuilder sb, String nl, String section,
            Object... kvPairs) {
        sb.append("  ").append(section).append(":").append(nl);
        for (int i = 0; i < kvPairs.length; i += 2) {
            String key = String.valueOf(kvPairs[i]);
            Object val = (i + 1 < kvPairs.length) ? kvPairs[i + 1] : null;
            sb.append("    ").append(key).append(": ").append(val).append(nl);
        }
    }

    @Data
    public static class Input {

        /**
         * 入力ファイルです。
         */
        @NotBlank
        private String file = "./data/absorption.csv";

        /**
         * 1 列目が波長（nm）かどうかです。false の場合はエネルギー（eV）です。
         */
        private boolean wavelength = true;

        /**
         * 1 始まりのデータセット番号です。空の場合はすべての列を解析します。
         */
        private List<Integer> datasets = List.of();
    }

    @Data
    public static class Baseline {

        /**
         * ベースラインの関数形（0=なし, 1=1次式, 2=E^4）です。1 と 2 は lower/upper が必須です。
         */
        @Min(0)
        @Max(2)
        private int fitmode = 0;

        /**
         * 当てはめ範囲の下端（eV）です。
         */
        private Double lower;

        /**
         * 当てはめ範囲の上端（eV）です。
         */
        private Double upper;
    }

    @Data
    public static class Fit {

        /**
         * フィッティング範囲の下端（eV）です。
         */
        private Double lower;

        /**
         * フィッティング範囲の上端（eV）です。
         */
        private Double upper;

        /**
         * バンドギャップ近傍フィッティングを行うかどうかです。
         */
        private boolean autoRange = true;

        /**
         * 予備フィットを行うかどうかです。
         */
        private boolean preliminary = true;

        /**
         * 直前のデータセットの結果を初期値に使うかどうかです。
         */
        private boolean warmStart = false;

        /**
         * 規格化オフセットです。
         */
        private double deltaE = 0.2;

        /**
         * ノード密度です。
         */
        @Positive
        private int ns = 20;

        /**
         * 励起子級数の項数です。
         */
        @Positive
        private int seriesTerms = 50;

        /**
         * 最大反復回数です。
         */
        @Positive
        private int maxIterations = 2000;

        /**
         * 最大評価回数です。
         */
        @Positive
        private int maxEvaluations = 20000;

        /**
         * コストの相対許容誤差です。
         */
        @Positive
        private double costTolerance = 1e-12;

        /**
         * パラメータの相対許容誤差です。
         */
        @Positive
        private double parameterTolerance = 1e-10;

        /**
         * 境界張り付き判定の相対幅です。
         */
        private double saturationEpsilon = 1e-3;

        /**
         * q が 1 に近いと判定する幅です。
         */
        @Positive
        private double groundStateEpsilon = 1e-2;

        /**
         * 並列実行のスレッド数です（1 は逐次）。
         */
        @Positive
        private int parallelism = 1;
    }

    /**
     * 初期パラメータです。Eb, Gamma は eV で指定します。
     */
    @Data
    public static class StartPoint {

        /**
         * 初期 Eg（eV）です。未指定の場合はデータから求めます。
         */
        private Double eg;

        private double eb = 0.050;

        private double gamma = 0.100;

        private double ucvsq = 10.0;

        private double mhcnp = 0.060;

        private double q = 0.2;
    }

    /**
     * Eg 以外のパラメータの境界の上書き設定です。未指定のパラメータは既定の境界を用います。
     */
    @Data
    public static class Bounds {

        private Range eb;

        private Range gamma;

        private Range ucvsq;

        private Range mhcnp;

        private Range q;
    }

    @Data
    public static class Range {

        private double lower;

        private double upper;
    }

    @Data
    public static class Output {

        /**
         * 出力先ディレクトリです。
         */
        @NotBlank
        private String dir = "./out";
    }
}
