package io.stageflow.units.files;

import io.stageflow.core.model.UnitSpec;
import io.stageflow.core.spi.StageUnit;
import io.stageflow.core.spi.UnitProvider;

/**
 * {@link UnitProvider}s for the file units, listed in
 * {@code META-INF/services/io.stageflow.core.spi.UnitProvider}.
 */
public final class FileUnitProviders {

    private FileUnitProviders() {}

    /** Provides {@value FileScanProcessor#ID}. */
    public static final class FileScan implements UnitProvider {

        @Override
        public String id() {
            return FileScanProcessor.ID;
        }

        @Override
        public StageUnit create(UnitSpec spec) {
            return new FileScanProcessor(spec);
        }
    }

    /** Provides {@value FileDigestProcessor#ID}. */
    public static final class FileDigestUnit implements UnitProvider {

        @Override
        public String id() {
            return FileDigestProcessor.ID;
        }

        @Override
        public StageUnit create(UnitSpec spec) {
            return new FileDigestProcessor(spec);
        }
    }

    /** Provides {@value ManifestWriterPostProcessor#ID}. */
    public static final class ManifestWriter implements UnitProvider {

        @Override
        public String id() {
            return ManifestWriterPostProcessor.ID;
        }

        @Override
        public StageUnit create(UnitSpec spec) {
            return new ManifestWriterPostProcessor(spec);
        }
    }
}
