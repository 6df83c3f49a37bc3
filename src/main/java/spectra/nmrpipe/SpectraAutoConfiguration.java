package spectra.nmrpipe;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import spectra.SpectrumFactory;
import spectra.transform.FourierTransform;
import spectra.transform.StandardFourierTransform;

@AutoConfiguration
@EnableConfigurationProperties(SpectraProperties.class)
public class SpectraAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public FourierTransform fourierTransform(SpectraProperties properties) {
        return new StandardFourierTransform(properties.fftShift(), properties.normalization());
    }

    @Bean
    @ConditionalOnMissingBean
    public SpectrumFactory spectrumFactory(FourierTransform fourierTransform) {
        return new NmrPipeSpectrumFactory(fourierTransform);
    }
}
