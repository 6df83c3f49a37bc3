package spectra;

import com.google.inject.AbstractModule;
import com.google.inject.Singleton;
import spectra.nmrpipe.NmrPipeModule;
import spectra.nmrpipe.NmrPipeSpectrumFactory;
import spectra.transform.FourierTransform;
import spectra.transform.StandardFourierTransform;

/**
 * Guice module for the spectra package.
 *
 * <p>Binds the spectrum interfaces to their NMRPipe and Commons Math implementations.
 */
public class Module extends AbstractModule {

    @Override
    protected void configure() {
        install(new NmrPipeModule());

        // Kernel is stateless, share it
        bind(FourierTransform.class).to(StandardFourierTransform.class).in(Singleton.class);

        bind(SpectrumFactory.class).to(NmrPipeSpectrumFactory.class);
    }
}
