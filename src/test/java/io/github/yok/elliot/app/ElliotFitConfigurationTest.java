package io.github.yok.elliot.app;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.elliot.core.baseline.BaselineMode;
import io.github.yok.elliot.core.model.ElliotSpectralModel;
import io.github.yok.elliot.core.model.FitParameter;
import io.github.yok.elliot.core.pipeline.FitSettings;
import org.junit.jupiter.api.Test;

class ElliotFitConfigurationTest {

    @Test
    void fitSettings_shouldUseDefaultsWhenNothingIsConfigured() {
        FitSettings settings = new ElliotFitConfiguration(new ElliotProperties()).fitSettings();

        assertEquals(BaselineMode.NONE, settings.getBaselineMode());
        assertNull(settings.getBaselineRange());
        assertNull(settings.getFitRange());
        assertNull(settings.getInitialEg());
        assertTrue(settings.isAutoRangeEnabled());
        assertTrue(settings.isPreliminaryEnabled());
        assertFalse(settings.isWarmStart());
        assertEquals(0.050, settings.getStartPoint().getEb(), 0.0);
        assertEquals(0.2, settings.getDeltaE(), 0.0);
    }

    @Test
    void fitSettings_shouldApplyBaselineRangeAndBoundOverrides() {
        ElliotProperties p = new ElliotProperties();
        p.getBaseline().setFitmode(2);
        p.getBaseline().setLower(3.2);
        p.getBaseline().setUpper(3.0);
        p.getStartPoint().setEg(2.4);
        ElliotProperties.Range q = new ElliotProperties.Range();
        q.setLower(0.1);
        q.setUpper(0.9);
        p.getBounds().setQ(q);

        FitSettings settings = new ElliotFitConfiguration(p).fitSettings();

        assertEquals(BaselineMode.RAYLEIGH, settings.getBaselineMode());
        assertEquals(3.0, settings.getBaselineRange().getLower(), 0.0);
        assertEquals(3.2, settings.getBaselineRange().getUpper(), 0.0);
        assertEquals(2.4, settings.getInitialEg(), 0.0);
        assertEquals(0.1, settings.getBounds().lowerOf(FitParameter.Q), 0.0);
        assertEquals(0.9, settings.getBounds().upperOf(FitParameter.Q), 0.0);
    }

    @Test
    void fitSettings_shouldRequireBaselineRangeForFittedBaseline() {
        ElliotProperties p = new ElliotProperties();
        p.getBaseline().setFitmode(1);

        assertThrows(IllegalStateException.class,
                () -> new ElliotFitConfiguration(p).fitSettings());

        p.getBaseline().setFitmode(2);
        assertThrows(IllegalStateException.class,
                () -> new ElliotFitConfiguration(p).fitSettings());
    }

    @Test
    void spectralModel_shouldDeriveNodeCountFromNs() {
        ElliotProperties p = new ElliotProperties();
        p.getFit().setNs(30);

        ElliotSpectralModel model =
                (ElliotSpectralModel) new ElliotFitConfiguration(p).spectralModel();

        assertEquals(300, model.getIntegrationNodes());
        assertEquals(50, model.getSeriesTerms());
    }

    @Test
    void toMultilineString_shouldListEverySection() {
        String text = new ElliotProperties().toMultilineString();

        for (String section : new String[] {"input:", "baseline:", "fit:", "startPoint:",
                "bounds:", "output:"}) {
            assertTrue(text.contains(section), section);
        }
    }
}
