package io.vena.geoh5.store;

import java.util.AbstractMap;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.jetbrains.annotations.Nullable;

import static java.util.Collections.emptyList;
import static java.util.Collections.emptyMap;
import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.toList;

/**
 * An immutable, insertion-ordered map of named attribute values, as exchanged
 * with a {@link ContainerStore}.
 *
 * <p>
 * Values are restricted to what a document store can carry without a schema:
 * {@link String}, {@link Number}, {@link Boolean}, <code>double[]</code>,
 * <code>int[]</code>, {@link List}s of those, and nested {@link AttributeMap}s.
 * The typed accessors are lenient about representation: a store that reads
 * <code>double[]</code> back as a <code>List&lt;Double&gt;</code>, or a UUID
 * back as a {@link String}, still yields the expected values.
 */
public final class AttributeMap extends AbstractMap<String, Object> {
	private final Map<String, Object> contents;

	private AttributeMap(Map<String, Object> contents) {
		this.contents = unmodifiableMap(contents);
	}

	public static AttributeMap empty() {
		return EMPTY;
	}

	public static AttributeMap fromOrderedMap(Map<String, ?> entries) {
		LinkedHashMap<String, Object> map = new LinkedHashMap<>();
		entries.forEach((key, value) -> map.put(requireNonNull(key), normalized(value)));
		return new AttributeMap(map);
	}

	/**
	 * @return a copy of this map with the given entry added or replaced.
	 * A null <code>value</code> removes the entry, so optional attributes
	 * can be written unconditionally.
	 */
	public AttributeMap with(String key, @Nullable Object value) {
		LinkedHashMap<String, Object> map = new LinkedHashMap<>(contents);
		if (value == null) {
			if (!map.containsKey(key)) {
				return this;
			}
			map.remove(key);
		} else {
			map.put(requireNonNull(key), normalized(value));
		}
		return new AttributeMap(map);
	}

	public Optional<String> string(String key) {
		return Optional.ofNullable(contents.get(key)).map(Object::toString);
	}

	public Optional<Double> number(String key) {
		Object value = contents.get(key);
		if (value == null) {
			return Optional.empty();
		} else if (value instanceof Number) {
			return Optional.of(((Number) value).doubleValue());
		} else {
			return Optional.of(Double.parseDouble(value.toString()));
		}
	}

	public Optional<Integer> integer(String key) {
		return number(key).map(Double::intValue);
	}

	public boolean bool(String key, boolean defaultValue) {
		Object value = contents.get(key);
		if (value == null) {
			return defaultValue;
		} else if (value instanceof Boolean) {
			return (Boolean) value;
		} else {
			return Boolean.parseBoolean(value.toString());
		}
	}

	public Optional<UUID> uuid(String key) {
		return string(key).map(UUID::fromString);
	}

	public Optional<double[]> doubles(String key) {
		Object value = contents.get(key);
		if (value == null) {
			return Optional.empty();
		} else if (value instanceof double[]) {
			return Optional.of(((double[]) value).clone());
		} else if (value instanceof int[]) {
			int[] ints = (int[]) value;
			double[] result = new double[ints.length];
			for (int i = 0; i < ints.length; i++) {
				result[i] = ints[i];
			}
			return Optional.of(result);
		} else if (value instanceof List) {
			List<?> list = (List<?>) value;
			double[] result = new double[list.size()];
			for (int i = 0; i < result.length; i++) {
				result[i] = ((Number) list.get(i)).doubleValue();
			}
			return Optional.of(result);
		} else {
			throw new IllegalArgumentException("Attribute \"" + key + "\" is not numeric array: " + value.getClass().getSimpleName());
		}
	}

	public Optional<int[]> ints(String key) {
		Object value = contents.get(key);
		if (value == null) {
			return Optional.empty();
		} else if (value instanceof int[]) {
			return Optional.of(((int[]) value).clone());
		} else if (value instanceof List) {
			List<?> list = (List<?>) value;
			int[] result = new int[list.size()];
			for (int i = 0; i < result.length; i++) {
				result[i] = ((Number) list.get(i)).intValue();
			}
			return Optional.of(result);
		} else {
			throw new IllegalArgumentException("Attribute \"" + key + "\" is not an integer array: " + value.getClass().getSimpleName());
		}
	}

	public List<String> strings(String key) {
		Object value = contents.get(key);
		if (value == null) {
			return emptyList();
		} else if (value instanceof List) {
			return ((List<?>) value).stream().map(Object::toString).collect(toList());
		} else {
			throw new IllegalArgumentException("Attribute \"" + key + "\" is not a list: " + value.getClass().getSimpleName());
		}
	}

	public List<AttributeMap> maps(String key) {
		Object value = contents.get(key);
		if (value == null) {
			return emptyList();
		} else if (value instanceof List) {
			return ((List<?>) value).stream()
				.map(AttributeMap::normalized)
				.map(AttributeMap.class::cast)
				.collect(toList());
		} else {
			throw new IllegalArgumentException("Attribute \"" + key + "\" is not a list of maps: " + value.getClass().getSimpleName());
		}
	}

	private static Object normalized(Object value) {
		if (value instanceof AttributeMap) {
			return value;
		} else if (value instanceof Map) {
			@SuppressWarnings("unchecked")
			Map<String, ?> map = (Map<String, ?>) value;
			return fromOrderedMap(map);
		} else if (value instanceof double[]) {
			return ((double[]) value).clone();
		} else if (value instanceof int[]) {
			return ((int[]) value).clone();
		} else if (value instanceof List) {
			return Collections.unmodifiableList(((List<?>) value).stream()
				.map(AttributeMap::normalized)
				.collect(toList()));
		} else if (value instanceof UUID) {
			return value.toString();
		} else if (value instanceof Enum) {
			return ((Enum<?>) value).name();
		} else {
			return requireNonNull(value);
		}
	}

	@Override
	public Set<Entry<String, Object>> entrySet() {
		return contents.entrySet();
	}

	private static final AttributeMap EMPTY = new AttributeMap(emptyMap());
}
