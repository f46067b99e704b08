package io.stageflow.core.spi;

/**
 * Discovery SPI. Implementations are listed in {@code META-INF/services/io.stageflow.core.spi.UnitProvider}
 * and loaded with {@link java.util.ServiceLoader}, either from the application class path or from
 * unit jars found in a plugin directory.
 *
 * <p>
 * Providers need a public no-argument constructor and should be stateless; {@link #create} is
 * called once per stage that references {@link #id()}.
 */
public interface UnitProvider extends UnitFactory {

    /**
     * The registry name, as used in the {@code impl} field of a pipeline spec.
     *
     * @return a non-null, non-blank identifier (lowercase, dash separated by convention)
     */
    String id();
}
