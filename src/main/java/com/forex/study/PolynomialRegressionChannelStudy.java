package com.forex.study;

import com.forex.domain.vo.Tick;
import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;
import org.apache.commons.math3.fitting.PolynomialCurveFitter;
import org.apache.commons.math3.fitting.WeightedObservedPoints;

import java.util.List;
import java.util.Map;

/**
 * 多项式回归通道
 * <p>
 * 参数 length、degree、deviations（默认2.0）。对最近 length 个收盘价做多项式拟合，
 * 输出最新点的拟合值 regression，以及加减 deviations 倍残差标准差的 upper 和 lower。
 * </p>
 */
public class PolynomialRegressionChannelStudy extends AbstractStudy {

    private final int length;
    private final int degree;
    private final double deviations;
    private final PolynomialCurveFitter fitter;

    public PolynomialRegressionChannelStudy(Map<String, ? extends Number> inputs, Map<String, String> outputMap) {
        super(inputs, outputMap);
        this.length = getIntInput("length");
        this.degree = getIntInput("degree");
        this.deviations = getInput("deviations", 2.0);
        if (length <= degree) {
            throw new IllegalArgumentException("length 必须大于 degree: length=" + length + ", degree=" + degree);
        }
        this.fitter = PolynomialCurveFitter.create(degree);
    }

    @Override
    protected void calculate(Map<String, Double> outputs) {
        List<Tick> data = getData();
        if (data.size() < length) {
            return;
        }

        // x 归一化到 [0, 1]，避免高次项数值过大
        double scale = length - 1;
        double[] closes = new double[length];
        WeightedObservedPoints points = new WeightedObservedPoints();
        int start = data.size() - length;
        for (int i = 0; i < length; i++) {
            closes[i] = data.get(start + i).get(Tick.CLOSE);
            points.add(i / scale, closes[i]);
        }

        PolynomialFunction function = new PolynomialFunction(fitter.fit(points.toList()));

        double sumOfSquares = 0.0;
        for (int i = 0; i < length; i++) {
            double residual = closes[i] - function.value(i / scale);
            sumOfSquares += residual * residual;
        }
        double standardDeviation = Math.sqrt(sumOfSquares / length);
        double regression = function.value(1.0);

        setOutput(outputs, "regression", regression);
        setOutput(outputs, "upper", regression + deviations * standardDeviation);
        setOutput(outputs, "lower", regression - deviations * standardDeviation);
    }
}
