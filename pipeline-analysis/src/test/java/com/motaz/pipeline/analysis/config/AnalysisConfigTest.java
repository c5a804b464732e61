package com.motaz.pipeline.analysis.config;

import com.motaz.pipeline.analysis.exception.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AnalysisConfigTest {

    @Test
    void defaultsAreValid() {
        AnalysisConfig config = AnalysisConfig.defaults();

        assertThatCode(config::validate).doesNotThrowAnyException();
        assertThat(config.getKernel()).isEqualTo(KernelType.RBF);
        assertThat(config.getNu()).isEqualTo(0.05);
        assertThat(config.getGamma()).isEqualTo(GammaSetting.AUTO);
        assertThat(config.getWindowSize()).isEqualTo(400);
        assertThat(config.getStepSize()).isEqualTo(1);
        assertThat(config.getClusters()).isEqualTo(10);
        assertThat(config.getLinkage()).isEqualTo(LinkageType.WARD);
        assertThat(config.getMinGap()).isEqualTo(Duration.ofSeconds(10));
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.0, -0.1, 1.5})
    void rejectsNuOutsideTheUnitInterval(double nu) {
        AnalysisConfig config = AnalysisConfig.defaults().toBuilder().nu(nu).build();

        assertThatThrownBy(config::validate).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void rejectsNonPositiveSizes() {
        assertThatThrownBy(() -> AnalysisConfig.builder().windowSize(0).build().validate())
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> AnalysisConfig.builder().stepSize(-1).build().validate())
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> AnalysisConfig.builder().clusters(0).build().validate())
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> AnalysisConfig.builder().minGap(Duration.ofSeconds(-5)).build().validate())
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void parsesKernelAndLinkageNames() {
        assertThat(KernelType.fromName(" Poly ")).isEqualTo(KernelType.POLY);
        assertThat(LinkageType.fromName("single")).isEqualTo(LinkageType.SINGLE);
        assertThatThrownBy(() -> KernelType.fromName("cosine")).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> LinkageType.fromName(null)).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void resolvesGamma() {
        assertThat(GammaSetting.parse("auto").resolve(17, 2.0)).isCloseTo(1.0 / 17, within(1e-15));
        assertThat(GammaSetting.parse("SCALE").resolve(4, 0.5)).isCloseTo(0.5, within(1e-15));
        assertThat(GammaSetting.parse("0.25").resolve(17, 2.0)).isEqualTo(0.25);
        assertThat(GammaSetting.parse("0.25")).isEqualTo(GammaSetting.of(0.25));
        assertThat(GammaSetting.SCALE).hasToString("scale");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "wide", "-1", "0"})
    void rejectsBadGamma(String text) {
        assertThatThrownBy(() -> GammaSetting.parse(text)).isInstanceOf(ConfigurationException.class);
    }
}
