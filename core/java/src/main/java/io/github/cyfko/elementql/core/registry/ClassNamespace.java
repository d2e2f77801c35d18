package io.github.cyfko.elementql.core.registry;

import io.github.cyfko.elementql.core.spi.ElementClassRegistry;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * {@link ElementClassRegistry} resolving simple class names inside one Java package.
 * <p>
 * A name {@code N} resolves to the class {@code <package>.N} when it exists and is a subtype
 * of the namespace's base type. Classes living elsewhere can be made resolvable with
 * {@link #register(Class)}; explicit registrations take precedence over package lookup.
 * Successful lookups are cached.
 * </p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * ClassNamespace classes = new ClassNamespace("com.acme.model", MemoryElement.class)
 *     .register(ViewPlan.class);
 *
 * classes.byName("WallType");   // Optional[class com.acme.model.WallType]
 * classes.byName("ViewPlan");   // Optional[class com.acme.views.ViewPlan]
 * classes.byName("String");     // Optional.empty()
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ClassNamespace implements ElementClassRegistry {

    private static final Logger log = Logger.getLogger(ClassNamespace.class.getName());

    private final String packageName;
    private final Class<?> baseType;
    private final ClassLoader classLoader;
    private final Map<String, Class<?>> classes = new ConcurrentHashMap<>();

    /**
     * Creates a namespace over the package of {@code baseType}.
     *
     * @param baseType type every resolved class must extend or implement
     */
    public ClassNamespace(Class<?> baseType) {
        this(baseType.getPackageName(), baseType);
    }

    /**
     * @param packageName package searched for simple names
     * @param baseType    type every resolved class must extend or implement
     */
    public ClassNamespace(String packageName, Class<?> baseType) {
        this.packageName = Objects.requireNonNull(packageName, "packageName cannot be null");
        this.baseType = Objects.requireNonNull(baseType, "baseType cannot be null");
        this.classLoader = baseType.getClassLoader();
    }

    /**
     * Makes a class resolvable by its simple name, wherever it lives.
     *
     * @param elementClass a subtype of the base type
     * @return this namespace
     * @throws IllegalArgumentException if the class is not a subtype of the base type, or its
     *                                  simple name is already bound to another class
     */
    public ClassNamespace register(Class<?> elementClass) {
        Objects.requireNonNull(elementClass, "elementClass cannot be null");
        if (!baseType.isAssignableFrom(elementClass)) {
            throw new IllegalArgumentException(elementClass.getName() + " is not a " + baseType.getSimpleName());
        }
        Class<?> previous = classes.putIfAbsent(elementClass.getSimpleName(), elementClass);
        if (previous != null && previous != elementClass) {
            throw new IllegalArgumentException("Class name [" + elementClass.getSimpleName()
                    + "] is already registered as " + previous.getName());
        }
        return this;
    }

    @Override
    public Optional<Class<?>> byName(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        String simpleName = name.trim();

        Class<?> cached = classes.get(simpleName);
        if (cached != null) return Optional.of(cached);

        // a dotted name would escape the namespace
        if (simpleName.indexOf('.') >= 0) return Optional.empty();

        String qualifiedName = packageName.isEmpty() ? simpleName : packageName + "." + simpleName;
        try {
            Class<?> found = Class.forName(qualifiedName, false, classLoader);
            if (!baseType.isAssignableFrom(found)) {
                log.fine(() -> qualifiedName + " is not a " + baseType.getSimpleName());
                return Optional.empty();
            }
            classes.putIfAbsent(simpleName, found);
            return Optional.of(found);
        } catch (ClassNotFoundException e) {
            log.fine(() -> "No class " + qualifiedName);
            return Optional.empty();
        }
    }

    public String getPackageName() {
        return packageName;
    }

    public Class<?> getBaseType() {
        return baseType;
    }
}
