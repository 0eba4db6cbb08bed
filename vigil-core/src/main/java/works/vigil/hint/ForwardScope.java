package works.vigil.hint;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * The namespace in which {@link ForwardRef forward references} are resolved.
 * <p>
 * A name is looked up first among the scope's explicit {@link #define definitions},
 * then as a fully-qualified class name,
 * then as a simple class name in each of the scope's {@link #importPackage imported packages}, in order.
 * Like a Java source file, every scope implicitly imports {@code java.lang}.
 * <p>
 * Definitions may be added at any time up to the moment a hint that refers to them
 * is compiled; after that, the compiled checker keeps whatever was resolved.
 * Scopes are compared by identity.
 */
public final class ForwardScope {
	/**
	 * Has no definitions, imports only {@code java.lang}, and can't be modified.
	 */
	public static final ForwardScope EMPTY = new ForwardScope(ForwardScope.class.getClassLoader(), false);

	private final Map<String, Object> definitions = new ConcurrentHashMap<>();
	private final List<String> packages = new ArrayList<>();
	private final ClassLoader classLoader;
	private final boolean modifiable;

	private ForwardScope(ClassLoader classLoader, boolean modifiable) {
		this.classLoader = classLoader;
		this.modifiable = modifiable;
		this.packages.add("java.lang");
	}

	public static ForwardScope create() {
		return new ForwardScope(ForwardScope.class.getClassLoader(), true);
	}

	public static ForwardScope using(ClassLoader classLoader) {
		return new ForwardScope(requireNonNull(classLoader), true);
	}

	/**
	 * @return {@code this}
	 * @throws IllegalStateException if {@code name} is already defined
	 * @throws UnsupportedOperationException if this is {@link #EMPTY}
	 */
	public ForwardScope define(String name, Object hint) {
		requireNonNull(name);
		requireModifiable();
		if (definitions.putIfAbsent(name, hint == null ? Sentinel.NONE : hint) != null) {
			throw new IllegalStateException("Forward reference name already defined: " + name);
		}
		return this;
	}

	/**
	 * Makes classes in the given package resolvable by their simple names.
	 *
	 * @return {@code this}
	 * @throws UnsupportedOperationException if this is {@link #EMPTY}
	 */
	public ForwardScope importPackage(String packageName) {
		requireModifiable();
		synchronized (packages) {
			packages.add(requireNonNull(packageName));
		}
		return this;
	}

	/**
	 * @return the package of {@code c}, imported as per {@link #importPackage}
	 */
	public ForwardScope importPackageOf(Class<?> c) {
		return importPackage(c.getPackageName());
	}

	/**
	 * @return the hint {@code name} refers to, or empty if it can't be found
	 */
	public Optional<Object> lookup(String name) {
		Object defined = definitions.get(name);
		if (defined != null) {
			LOGGER.trace("Forward reference {} is defined as {}", name, defined);
			return Optional.of(defined);
		}
		Optional<Object> loaded = loadClass(name);
		if (loaded.isPresent()) {
			return loaded;
		}
		List<String> candidates;
		synchronized (packages) {
			candidates = List.copyOf(packages);
		}
		for (String p : candidates) {
			loaded = loadClass(p + "." + name);
			if (loaded.isPresent()) {
				return loaded;
			}
		}
		return Optional.empty();
	}

	private void requireModifiable() {
		if (!modifiable) {
			throw new UnsupportedOperationException("The empty scope can't be modified; use ForwardScope.create()");
		}
	}

	private Optional<Object> loadClass(String className) {
		try {
			return Optional.of(Class.forName(className, false, classLoader));
		} catch (ClassNotFoundException e) {
			LOGGER.trace("No class named {}", className);
			return Optional.empty();
		}
	}

	@Override
	public String toString() {
		return "ForwardScope@" + Integer.toHexString(System.identityHashCode(this)) + definitions.keySet();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ForwardScope.class);
}
