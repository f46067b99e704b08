package io.stageflow.core.engine;

import io.stageflow.core.error.UnitInstantiationException;
import io.stageflow.core.error.UnitNotFoundException;
import io.stageflow.core.error.UnitTypeMismatchException;
import io.stageflow.core.model.ImplementationRef;
import io.stageflow.core.model.PostProcessorSpec;
import io.stageflow.core.model.ProcessorSpec;
import io.stageflow.core.model.UnitSpec;
import io.stageflow.core.spi.PostProcessor;
import io.stageflow.core.spi.Processor;
import io.stageflow.core.spi.StageUnit;
import io.stageflow.core.spi.UnitFactory;
import io.stageflow.core.spi.UnitProvider;
import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps implementation names to unit factories and turns spec references into live units.
 *
 * <p>
 * Two ways in: explicit {@link #register} calls, and {@link UnitProvider} discovery through
 * {@link ServiceLoader}, either on a class loader ({@link #discoverClasspath}) or over the unit jars
 * in a plugin location ({@link #discover}). Registration is last-write-wins and entries are never
 * removed. Resolution checks the produced instance against the requested capability, so a
 * post-processor named in a {@code processor} block fails the graph build with
 * {@link UnitTypeMismatchException}.
 *
 * <p>
 * Thread-safe: registration and lookup can happen concurrently. Class loaders opened by discovery
 * stay open until {@link #close()}, since registered providers load classes lazily from them.
 */
public final class UnitRegistry implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(UnitRegistry.class);

    /** File-name suffix a jar must carry to be picked up by a directory scan. */
    public static final String UNIT_JAR_SUFFIX = "-units.jar";

    private static final UnitRegistry GLOBAL = new UnitRegistry();

    private final Map<String, UnitFactory> factories = new ConcurrentHashMap<>();
    private final List<URLClassLoader> discoveryLoaders = new CopyOnWriteArrayList<>();
    private final ClassLoader parentLoader;

    public UnitRegistry() {
        this(UnitRegistry.class.getClassLoader());
    }

    /**
     * @param parentLoader parent for the class loaders opened over discovered unit jars; must be
     *                     able to see the {@code io.stageflow.core.spi} types
     */
    public UnitRegistry(ClassLoader parentLoader) {
        this.parentLoader = Objects.requireNonNull(parentLoader, "parentLoader must not be null");
        factories.put(IdentityPostProcessor.NAME, spec -> IdentityPostProcessor.INSTANCE);
    }

    /** The process-wide registry. Independent instances can still be created, e.g. for tests. */
    public static UnitRegistry global() {
        return GLOBAL;
    }

    /**
     * Registers a factory under {@code name}, replacing any earlier binding.
     *
     * @throws IllegalArgumentException if {@code name} is blank
     */
    public void register(String name, UnitFactory factory) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(factory, "factory must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("unit name must not be blank");
        }
        UnitFactory previous = factories.put(name, factory);
        if (previous != null && previous != factory) {
            LOG.debug("Unit '{}' re-registered; previous binding replaced", name);
        }
    }

    /** Registers a provider under its own {@link UnitProvider#id()}. */
    public void registerProvider(UnitProvider provider) {
        Objects.requireNonNull(provider, "provider must not be null");
        register(provider.id(), provider);
    }

    public boolean hasUnit(String name) {
        return factories.containsKey(name);
    }

    /** Registered names, sorted. */
    public Set<String> names() {
        return new TreeSet<>(factories.keySet());
    }

    public int size() {
        return factories.size();
    }

    /**
     * Registers every {@link UnitProvider} visible to {@code classLoader}.
     *
     * @return the ids registered, in discovery order
     */
    public List<String> discoverClasspath(ClassLoader classLoader) {
        Objects.requireNonNull(classLoader, "classLoader must not be null");
        List<String> registered = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        loadProviders(ServiceLoader.load(UnitProvider.class, classLoader), null, "classpath", registered, skipped);
        LOG.info("Classpath discovery registered {} unit(s): {}", registered.size(), registered);
        return registered;
    }

    /**
     * Scans a plugin location and registers every provider it contains. A directory is searched
     * (non-recursively) for jars named {@code *}{@value #UNIT_JAR_SUFFIX}; a jar file is loaded
     * directly. Candidates that fail to load are logged at WARN and skipped; the scan always
     * completes.
     *
     * @param location directory or jar
     * @return ids registered and candidates skipped
     */
    public DiscoveryReport discover(Path location) {
        Objects.requireNonNull(location, "location must not be null");
        List<String> registered = new ArrayList<>();
        List<String> skipped = new ArrayList<>();

        List<Path> jars;
        try {
            jars = candidateJars(location);
        } catch (IOException e) {
            LOG.warn("Unit discovery could not list {}: {}", location, e.getMessage());
            skipped.add(location + ": " + e.getMessage());
            return new DiscoveryReport(location, registered, skipped);
        }

        for (Path jar : jars) {
            URLClassLoader loader;
            try {
                loader = new URLClassLoader(
                        "stageflow-units:" + jar.getFileName(), new URL[] {jar.toUri().toURL()}, parentLoader);
            } catch (MalformedURLException e) {
                LOG.warn("Skipping unit jar {}: {}", jar, e.getMessage());
                skipped.add(jar + ": " + e.getMessage());
                continue;
            }
            discoveryLoaders.add(loader);
            loadProviders(ServiceLoader.load(UnitProvider.class, loader), loader, jar.toString(), registered, skipped);
        }

        LOG.info(
                "Unit discovery in {}: {} jar(s), {} unit(s) registered, {} skipped",
                location,
                jars.size(),
                registered.size(),
                skipped.size());
        return new DiscoveryReport(location, registered, skipped);
    }

    /** Resolves the processor of a stage through {@code spec.impl()}. */
    public Processor resolveProcessor(ProcessorSpec spec, String stageName) {
        Objects.requireNonNull(spec, "spec must not be null");
        return resolveProcessor(spec.impl(), spec, stageName);
    }

    /**
     * Creates the processor {@code ref} points at. If the name is unknown and {@code ref} carries a
     * location, that location is discovered first.
     *
     * @throws UnitNotFoundException       if no factory is registered under the name
     * @throws UnitTypeMismatchException   if the factory does not produce a {@link Processor}
     * @throws UnitInstantiationException  if the factory throws or returns {@code null}
     */
    public Processor resolveProcessor(ImplementationRef ref, ProcessorSpec spec, String stageName) {
        return resolve(ref, spec, stageName, Processor.class);
    }

    /** Resolves the post-processor of a stage through {@code spec.impl()}. */
    public PostProcessor resolvePostProcessor(PostProcessorSpec spec, String stageName) {
        Objects.requireNonNull(spec, "spec must not be null");
        return resolvePostProcessor(spec.impl(), spec, stageName);
    }

    /** Post-processor counterpart of {@link #resolveProcessor(ImplementationRef, ProcessorSpec, String)}. */
    public PostProcessor resolvePostProcessor(ImplementationRef ref, PostProcessorSpec spec, String stageName) {
        return resolve(ref, spec, stageName, PostProcessor.class);
    }

    /** Closes the class loaders opened by {@link #discover}. Registered names stay bound. */
    @Override
    public void close() {
        for (URLClassLoader loader : discoveryLoaders) {
            try {
                loader.close();
            } catch (IOException e) {
                LOG.warn("Failed to close unit class loader {}: {}", loader.getName(), e.getMessage());
            }
        }
        discoveryLoaders.clear();
    }

    private <T extends StageUnit> T resolve(
            ImplementationRef ref, UnitSpec spec, String stageName, Class<T> capability) {
        Objects.requireNonNull(ref, "ref must not be null");
        Objects.requireNonNull(spec, "spec must not be null");
        String name = ref.name();

        UnitFactory factory = factories.get(name);
        if (factory == null && ref.hasLocation()) {
            LOG.info("Unit '{}' is not registered; discovering from {}", name, ref.location());
            discover(ref.location());
            factory = factories.get(name);
        }
        if (factory == null) {
            throw new UnitNotFoundException(
                    "No unit registered under '" + name + "' for stage '" + stageName + "'"
                            + (ref.hasLocation() ? " (searched " + ref.location() + ")" : "")
                            + "; known units: " + names(),
                    stageName,
                    name);
        }

        StageUnit unit;
        try {
            unit = factory.create(spec);
        } catch (RuntimeException e) {
            throw new UnitInstantiationException(
                    "Failed to create unit '" + name + "' for stage '" + stageName + "': " + e.getMessage(),
                    e,
                    stageName,
                    name);
        }
        if (unit == null) {
            throw new UnitInstantiationException(
                    "Factory for unit '" + name + "' returned null for stage '" + stageName + "'",
                    null,
                    stageName,
                    name);
        }
        if (!capability.isInstance(unit)) {
            throw new UnitTypeMismatchException(
                    "Unit '" + name + "' for stage '" + stageName + "' is a "
                            + unit.getClass().getSimpleName() + ", not a " + capability.getSimpleName(),
                    stageName,
                    name,
                    capability.getSimpleName(),
                    unit.getClass().getName());
        }
        LOG.debug("Resolved {} '{}' for stage '{}'", capability.getSimpleName(), name, stageName);
        return capability.cast(unit);
    }

    /**
     * Iterates a service loader, registering each provider. {@code owner}, when set, restricts
     * registration to providers defined by that loader so that parent-visible providers are not
     * reported as coming from a plugin jar.
     */
    private void loadProviders(
            ServiceLoader<UnitProvider> serviceLoader,
            ClassLoader owner,
            String origin,
            List<String> registered,
            List<String> skipped) {
        Iterator<UnitProvider> it = serviceLoader.iterator();
        while (true) {
            UnitProvider provider;
            try {
                if (!it.hasNext()) {
                    break;
                }
                provider = it.next();
            } catch (ServiceConfigurationError e) {
                LOG.warn("Skipping unit provider in {}: {}", origin, e.getMessage());
                skipped.add(origin + ": " + e.getMessage());
                continue;
            }
            if (owner != null && provider.getClass().getClassLoader() != owner) {
                continue;
            }
            String id;
            try {
                id = provider.id();
            } catch (RuntimeException e) {
                LOG.warn("Skipping unit provider {} in {}: id() failed", provider.getClass().getName(), origin, e);
                skipped.add(origin + ": " + provider.getClass().getName() + " id() failed: " + e.getMessage());
                continue;
            }
            if (id == null || id.isBlank()) {
                LOG.warn("Skipping unit provider {} in {}: blank id", provider.getClass().getName(), origin);
                skipped.add(origin + ": " + provider.getClass().getName() + " has a blank id");
                continue;
            }
            register(id, provider);
            registered.add(id);
            LOG.debug("Registered unit '{}' ({}) from {}", id, provider.getClass().getName(), origin);
        }
    }

    private static List<Path> candidateJars(Path location) throws IOException {
        if (Files.isRegularFile(location)) {
            return List.of(location);
        }
        if (!Files.isDirectory(location)) {
            throw new IOException("no such directory or jar");
        }
        try (Stream<Path> entries = Files.list(location)) {
            return entries.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(UNIT_JAR_SUFFIX))
                    .sorted()
                    .toList();
        }
    }
}
