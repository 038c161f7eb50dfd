package io.github.yok.elliot.core.model;

import lombok.Getter;

/**
 * Elliot 理論に基づく吸収スペクトルモデルです（分数次元 q を含む形）。
 *
 * <p>
 * 励起子系列とバンド間連続帯の和に係数 {@code ucvsq * sqrt(Eb)} を掛けた曲線を返します。
 * </p>
 *
 * <pre>
 *   Enx(n)     = Eg - Eb / (n - q)^2
 *   exciton(E) = Σ_{n=1..N} 2 Eb / (n - q)^3 · sech((E - Enx(n)) / Γ)
 *   b(E')      = 10 mhcnp (E' - Eg) + 126 mhcnp^2 (E' - Eg)^2
 *   f(E')      = (1 + b(E')) / (1 - exp(-2π sqrt(Eb / (E' - Eg))))
 *   band(E)    = ∫_{Eg}^{2Eg} sech((E - E') / Γ) f(E') dE'
 * </pre>
 *
 * <p>
 * 連続帯の積分は、問い合わせ格子に依存しない固定節点数の台形則で評価します。 E' = Eg では分母が 1 に近づき b = 0 となるため、f(Eg) = 1
 * を用います。
 * </p>
 */
@Getter
public final class ElliotSpectralModel implements SpectralModel {

    /**
     * 励起子系列の既定の打ち切り項数です。
     */
    public static final int DEFAULT_SERIES_TERMS = 50;

    /**
     * 連続帯積分の既定の節点数です（ベースライン補間点数 NS=20 の 10 倍）。
     */
    public static final int DEFAULT_INTEGRATION_NODES = 200;

    /**
     * 励起子系列の打ち切り項数です。
     */
    private final int seriesTerms;

    /**
     * 連続帯積分の節点数です（両端を含む）。
     */
    private final int integrationNodes;

    /**
     * 既定の打ち切り項数・節点数でモデルを生成します。
     */
    public ElliotSpectralModel() {
        this(DEFAULT_SERIES_TERMS, DEFAULT_INTEGRATION_NODES);
    }

    /**
     * モデルを生成します。
     *
     * @param seriesTerms 励起子系列の項数です（1 以上）
     * @param integrationNodes 連続帯積分の節点数です（2 以上）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public ElliotSpectralModel(int seriesTerms, int integrationNodes) {
        if (seriesTerms <= 0) {
            throw new IllegalArgumentException("seriesTerms は 1 以上が必要です: " + seriesTerms);
        }
        if (integrationNodes < 2) {
            throw new IllegalArgumentException("integrationNodes は 2 以上が必要です: " + integrationNodes);
        }
        this.seriesTerms = seriesTerms;
        this.integrationNodes = integrationNodes;
    }

    /**
     * 励起子成分・バンド成分・合計を評価します。
     *
     * @param parameters モデルパラメータです
     * @param energies エネルギー（eV）です
     * @return 成分ごとの曲線です
     * @throws IllegalArgumentException 引数が null の場合に発生します
     */
    @Override
    public SpectralComponents evaluateComponents(FittingParameters parameters, double[] energies) {
        if (parameters == null) {
            throw new IllegalArgumentException("parameters は null 不可です");
        }
        if (energies == null) {
            throw new IllegalArgumentException("energies は null 不可です");
        }

        double eg = parameters.getEg();
        double eb = parameters.getEb();
        double gamma = parameters.getGamma();
        double mhcnp = parameters.getMhcnp();
        double q = parameters.getQ();

        // 係数 sqrt(Eb) は連続帯の被積分関数に取り込み、Eb -> 0 の極限でも有限にします。
        double sqrtEb = Math.sqrt(Math.max(eb, 0.0));
        double ucvsq = parameters.getUcvsq();

        // 励起子系列の各準位（位置と重み）は E に依存しないので先に求めます。
        double[] levelEnergy = new double[seriesTerms];
        double[] levelWeight = new double[seriesTerms];
        for (int n = 1; n <= seriesTerms; n++) {
            double d = n - q;
            if (d == 0.0) {
                // q が整数 n に一致する準位は無限遠に押し出され、寄与しません。
                levelEnergy[n - 1] = Double.NEGATIVE_INFINITY;
                levelWeight[n - 1] = 0.0;
                continue;
            }
            levelEnergy[n - 1] = eg - eb / (d * d);
            levelWeight[n - 1] = 2.0 * eb / (d * d * d);
        }

        // 連続帯の節点と、sqrt(Eb) を掛けた f(E') を求めます。
        double[] nodes = new double[integrationNodes];
        double[] scaledDensity = new double[integrationNodes];
        double step = eg / (integrationNodes - 1);
        for (int k = 0; k < integrationNodes; k++) {
            double x = k * step;
            nodes[k] = eg + x;
            scaledDensity[k] = scaledContinuumDensity(x, eb, sqrtEb, mhcnp);
        }

        int m = energies.length;
        double[] exciton = new double[m];
        double[] band = new double[m];
        double[] total = new double[m];

        for (int i = 0; i < m; i++) {
            double e = energies[i];

            double a1 = 0.0;
            for (int n = 0; n < seriesTerms; n++) {
                double s = sech(e - levelEnergy[n], gamma);
                // sech が 0 に落ちた項は重みが発散していても寄与 0 とします（q→n の極限）。
                if (s != 0.0) {
                    a1 += levelWeight[n] * s;
                }
            }

            double a2 = 0.0;
            double prev = sech(e - nodes[0], gamma) * scaledDensity[0];
            for (int k = 1; k < integrationNodes; k++) {
                double cur = sech(e - nodes[k], gamma) * scaledDensity[k];
                a2 += 0.5 * (prev + cur) * step;
                prev = cur;
            }

            exciton[i] = ucvsq * sqrtEb * a1;
            band[i] = ucvsq * a2;
            total[i] = exciton[i] + band[i];
        }

        return new SpectralComponents(exciton, band, total);
    }

    /**
     * {@code sqrt(Eb) · f(Eg + x)} を返します。
     *
     * <p>
     * x = 0 では f = 1 の極限値を、Eb = 0 では {@code (1 + b) · sqrt(x) / 2π} の極限値を用います。
     * </p>
     *
     * @param x Eg からのエネルギー差（0 以上）です
     * @param eb 励起子束縛エネルギーです
     * @param sqrtEb sqrt(Eb) です
     * @param mhcnp 形状パラメータです
     * @return 係数込みの状態密度です
     */
    static double scaledContinuumDensity(double x, double eb, double sqrtEb, double mhcnp) {
        double b = 10.0 * mhcnp * x + 126.0 * mhcnp * mhcnp * x * x;
        if (x <= 0.0) {
            return sqrtEb;
        }
        if (eb <= 0.0) {
            return (1.0 + b) * Math.sqrt(x) / (2.0 * Math.PI);
        }
        double denominator = -Math.expm1(-2.0 * Math.PI * Math.sqrt(eb / x));
        return sqrtEb * (1.0 + b) / denominator;
    }

    /**
     * {@code sech(delta / gamma)} を返します。
     *
     * <p>
     * cosh がオーバーフローする場合は 0 を返します。 gamma が 0 以下のときはデルタ関数的な極限（delta = 0 で 1、それ以外で 0）とします。
     * </p>
     *
     * @param delta エネルギー差です
     * @param gamma 線幅です
     * @return sech の値です
     */
    static double sech(double delta, double gamma) {
        if (!(gamma > 0.0)) {
            return (delta == 0.0) ? 1.0 : 0.0;
        }
        double c = Math.cosh(delta / gamma);
        if (Double.isInfinite(c)) {
            return 0.0;
        }
        return 1.0 / c;
    }
}
