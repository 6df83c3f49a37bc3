package spectra.nmrpipe;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import lombok.NonNull;
import spectra.transform.FourierTransform;

/** Guice module providing the NMRPipe spectrum components. */
public class NmrPipeModule extends AbstractModule {

    @Provides
    @Singleton
    NmrPipeSpectrumFactory provideSpectrumFactory(@NonNull FourierTransform fourierTransform) {
        return new NmrPipeSpectrumFactory(fourierTransform);
    }
}
