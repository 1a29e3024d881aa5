package com.asad.player_profiler.service;

import com.asad.player_profiler.config.ProfilerProperties;
import com.asad.player_profiler.exception.DegenerateInputException;
import com.asad.player_profiler.model.ScalerParameters;
import com.asad.player_profiler.model.ScalerType;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ScalerServiceTest {

    private static final List<String> COLUMNS = List.of("a", "b", "c");

    private static final double[][] MATRIX = {
            {1.0, 10.0, 5.0},
            {2.0, 30.0, 5.0},
            {3.0, 20.0, 5.0},
            {6.0, 40.0, 5.0},
    };

    private static ScalerService scaler(ScalerType type) {
        ProfilerProperties properties = new ProfilerProperties();
        properties.getScaler().setType(type);
        return new ScalerService(properties);
    }

    private static double[] column(double[][] m, int j) {
        double[] c = new double[m.length];
        for (int i = 0; i < m.length; i++) c[i] = m[i][j];
        return c;
    }

    @Test
    void standardScalingCentersAndUnitsEachColumn() {
        ScalerService service = scaler(ScalerType.STANDARD);

        ScalerParameters params = service.fit(MATRIX, COLUMNS);
        double[][] scaled = service.transform(params, MATRIX);

        for (int j = 0; j < 2; j++) {
            double[] col = column(scaled, j);
            assertThat(new Mean().evaluate(col)).isCloseTo(0.0, within(1e-12));
            assertThat(new StandardDeviation(false).evaluate(col)).isCloseTo(1.0, within(1e-12));
        }
    }

    @Test
    void constantColumnScalesToZero() {
        ScalerService service = scaler(ScalerType.STANDARD);

        ScalerParameters params = service.fit(MATRIX, COLUMNS);

        assertThat(params.scale()[2]).isEqualTo(1.0);
        assertThat(column(service.transform(params, MATRIX), 2)).containsOnly(0.0);
    }

    @Test
    void minMaxScalingMapsOntoUnitInterval() {
        ScalerService service = scaler(ScalerType.MIN_MAX);

        double[][] scaled = service.transform(service.fit(MATRIX, COLUMNS), MATRIX);

        assertThat(column(scaled, 0)).containsExactly(0.0, 0.2, 0.4, 1.0);
        assertThat(column(scaled, 1)).contains(0.0, 1.0);
    }

    @Test
    void refittingOnScaledDataIsIdentity() {
        ScalerService service = scaler(ScalerType.STANDARD);
        double[][] once = service.transform(service.fit(MATRIX, COLUMNS), MATRIX);

        ScalerParameters again = service.fit(once, COLUMNS);
        double[][] twice = service.transform(again, once);

        for (int i = 0; i < once.length; i++) {
            for (int j = 0; j < once[i].length; j++) {
                assertThat(twice[i][j]).isCloseTo(once[i][j], within(1e-9));
            }
        }
    }

    @Test
    void inverseTransformRestoresInput() {
        ScalerService service = scaler(ScalerType.STANDARD);
        ScalerParameters params = service.fit(MATRIX, COLUMNS);

        double[] back = params.inverseTransform(params.transform(MATRIX[3]));

        assertThat(back).containsExactly(new double[]{6.0, 40.0, 5.0}, within(1e-12));
    }

    @Test
    void rejectsFewerThanTwoInformativeColumns() {
        double[][] flat = {{1.0, 7.0, 5.0}, {2.0, 7.0, 5.0}, {3.0, 7.0, 5.0}};

        assertThatThrownBy(() -> scaler(ScalerType.STANDARD).fit(flat, COLUMNS))
                .isInstanceOf(DegenerateInputException.class);
    }

    @Test
    void rejectsEmptyPopulation() {
        assertThatThrownBy(() -> scaler(ScalerType.STANDARD).fit(new double[0][], COLUMNS))
                .isInstanceOf(DegenerateInputException.class);
    }

    @Test
    void transformChecksWidth() {
        ScalerParameters params = scaler(ScalerType.STANDARD).fit(MATRIX, COLUMNS);

        assertThatThrownBy(() -> params.transform(new double[]{1.0, 2.0}))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
