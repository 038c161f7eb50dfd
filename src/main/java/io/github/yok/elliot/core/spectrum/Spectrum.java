package io.github.yok.elliot.core.spectrum;

import java.util.Arrays;
import java.util.function.DoublePredicate;

/**
 * 1 データセット分の吸収スペクトル（エネルギー昇順の (E, α) 列）を保持する不変クラスです。
 *
 * <p>
 * エネルギー軸は狭義単調増加であることを生成時に検査します。 配列の getter は防御的コピーを返します。
 * </p>
 */
public final class Spectrum {

    /**
     * エネルギー（eV、昇順）です。
     */
    private final double[] energies;

    /**
     * 吸収値です。
     */
    private final double[] absorption;

    /**
     * スペクトルを生成します。
     *
     * @param energies エネルギー（eV、狭義単調増加）です
     * @param absorption 吸収値です（energies と同じ長さ）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public Spectrum(double[] energies, double[] absorption) {
        if (energies == null || absorption == null) {
            throw new IllegalArgumentException("energies/absorption は null 不可です");
        }
        if (energies.length != absorption.length) {
            throw new IllegalArgumentException("energies と absorption の長さが一致しません: "
                    + energies.length + " != " + absorption.length);
        }
        for (int i = 0; i < energies.length; i++) {
            if (!Double.isFinite(energies[i]) || !Double.isFinite(absorption[i])) {
                throw new IllegalArgumentException("有限値でないデータ点があります: index=" + i);
            }
            if (i > 0 && !(energies[i] > energies[i - 1])) {
                throw new IllegalArgumentException(
                        "エネルギー軸は狭義単調増加である必要があります: index=" + i + ", E=" + energies[i]);
            }
        }
        this.energies = energies.clone();
        this.absorption = absorption.clone();
    }

    /**
     * 任意の順序のデータ点をエネルギー昇順に並べ替えてスペクトルを生成します。
     *
     * <p>
     * 波長（nm）から換算したエネルギー軸は降順になるため、読み込み時に使用します。
     * </p>
     *
     * @param energies エネルギー（eV）です
     * @param absorption 吸収値です
     * @return 昇順に並べ替えたスペクトルです
     */
    public static Spectrum sortedOf(double[] energies, double[] absorption) {
        if (energies == null || absorption == null || energies.length != absorption.length) {
            throw new IllegalArgumentException("energies と absorption は同じ長さの配列が必要です");
        }
        Integer[] order = new Integer[energies.length];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        Arrays.sort(order, (i, j) -> Double.compare(energies[i], energies[j]));

        double[] e = new double[energies.length];
        double[] a = new double[energies.length];
        for (int k = 0; k < order.length; k++) {
            e[k] = energies[order[k]];
            a[k] = absorption[order[k]];
        }
        return new Spectrum(e, a);
    }

    /**
     * データ点数を返します。
     *
     * @return データ点数です
     */
    public int size() {
        return energies.length;
    }

    /**
     * データ点が無いかどうかを返します。
     *
     * @return 空の場合は true です
     */
    public boolean isEmpty() {
        return energies.length == 0;
    }

    /**
     * エネルギー配列のコピーを返します。
     *
     * @return エネルギー（eV）です
     */
    public double[] getEnergies() {
        return energies.clone();
    }

    /**
     * 吸収値配列のコピーを返します。
     *
     * @return 吸収値です
     */
    public double[] getAbsorption() {
        return absorption.clone();
    }

    /**
     * i 番目のエネルギーを返します。
     *
     * @param i インデックスです
     * @return エネルギー（eV）です
     */
    public double energyAt(int i) {
        return energies[i];
    }

    /**
     * i 番目の吸収値を返します。
     *
     * @param i インデックスです
     * @return 吸収値です
     */
    public double absorptionAt(int i) {
        return absorption[i];
    }

    /**
     * 最小エネルギーを返します。
     *
     * @return 最小エネルギー（eV）です
     */
    public double minEnergy() {
        requireNotEmpty();
        return energies[0];
    }

    /**
     * 最大エネルギーを返します。
     *
     * @return 最大エネルギー（eV）です
     */
    public double maxEnergy() {
        requireNotEmpty();
        return energies[energies.length - 1];
    }

    /**
     * エネルギー軸の全範囲を返します。
     *
     * @return [最小, 最大] の区間です
     */
    public EnergyRange energySpan() {
        return EnergyRange.of(minEnergy(), maxEnergy());
    }

    /**
     * 吸収値の最大値を返します。
     *
     * @return 最大吸収値です
     */
    public double maxAbsorption() {
        requireNotEmpty();
        double max = Double.NEGATIVE_INFINITY;
        for (double v : absorption) {
            max = Math.max(max, v);
        }
        return max;
    }

    /**
     * 区間内（両端を含む）のデータ点数を返します。
     *
     * @param range 区間です
     * @return 点数です
     */
    public int countWithin(EnergyRange range) {
        int count = 0;
        for (double e : energies) {
            if (range.contains(e)) {
                count++;
            }
        }
        return count;
    }

    /**
     * 区間内（両端を含む）のデータ点だけからなる新しいスペクトルを返します。
     *
     * @param range 区間です
     * @return 部分スペクトルです（空の場合もあります）
     */
    public Spectrum restrict(EnergyRange range) {
        if (range == null) {
            throw new IllegalArgumentException("range は null 不可です");
        }
        return filter(range::contains);
    }

    /**
     * エネルギーに対する条件を満たすデータ点だけからなる新しいスペクトルを返します。
     *
     * @param energyFilter エネルギーに対する条件です
     * @return 部分スペクトルです
     */
    public Spectrum filter(DoublePredicate energyFilter) {
        int count = 0;
        for (double e : energies) {
            if (energyFilter.test(e)) {
                count++;
            }
        }
        double[] e = new double[count];
        double[] a = new double[count];
        int k = 0;
        for (int i = 0; i < energies.length; i++) {
            if (energyFilter.test(energies[i])) {
                e[k] = energies[i];
                a[k] = absorption[i];
                k++;
            }
        }
        return new Spectrum(e, a);
    }

    /**
     * 同じエネルギー軸で吸収値だけを差し替えた新しいスペクトルを返します。
     *
     * @param newAbsorption 新しい吸収値です
     * @return 新しいスペクトルです
     */
    public Spectrum withAbsorption(double[] newAbsorption) {
        return new Spectrum(energies, newAbsorption);
    }

    /**
     * エネルギー軸の百分位点を線形補間で返します（numpy の既定と同じ補間）。
     *
     * @param percent 百分位（0〜100）です
     * @return 百分位点のエネルギー（eV）です
     */
    public double energyPercentile(double percent) {
        requireNotEmpty();
        if (!(percent >= 0.0 && percent <= 100.0)) {
            throw new IllegalArgumentException("percent は [0, 100] が必要です: " + percent);
        }
        double pos = (energies.length - 1) * percent / 100.0;
        int lo = (int) Math.floor(pos);
        int hi = Math.min(lo + 1, energies.length - 1);
        double frac = pos - lo;
        return energies[lo] + (energies[hi] - energies[lo]) * frac;
    }

    /**
     * エネルギー軸の中央値を返します。
     *
     * @return 中央値（eV）です
     */
    public double medianEnergy() {
        return energyPercentile(50.0);
    }

    private void requireNotEmpty() {
        if (energies.length == 0) {
            throw new IllegalStateException("スペクトルが空です");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Spectrum)) {
            return false;
        }
        Spectrum other = (Spectrum) o;
        return Arrays.equals(energies, other.energies)
                && Arrays.equals(absorption, other.absorption);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(energies) + Arrays.hashCode(absorption);
    }

    @Override
    public String toString() {
        if (energies.length == 0) {
            return "Spectrum(size=0)";
        }
        return "Spectrum(size=" + energies.length + ", E=[" + energies[0] + ", "
                + energies[energies.length - 1] + "])";
    }
}
