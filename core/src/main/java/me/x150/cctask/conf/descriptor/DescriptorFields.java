package me.x150.cctask.conf.descriptor;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Base of descriptor DTOs. Every public instance field annotated with {@link DescriptorValue} becomes a key; the
 * class tracks which keys were assigned so missing required ones can be listed.
 */
public abstract class DescriptorFields {
	private final Map<String, VarHandle> entries;
	private final Map<String, DescriptorValue> meta;
	private final String[] keys;
	private final BitSet setKeys;

	protected DescriptorFields() {
		MethodHandles.Lookup lookup = MethodHandles.lookup();
		List<String> notPublic = Arrays.stream(getClass().getDeclaredFields())
				.filter(f -> f.isAnnotationPresent(DescriptorValue.class))
				.filter(f -> !Modifier.isPublic(f.getModifiers()))
				.map(Field::toString).toList();
		if (!notPublic.isEmpty()) {
			throw new IllegalStateException("Fields have @DescriptorValue but aren't public: " + notPublic);
		}
		List<Field> fields = discoverFields(getClass());
		entries = fields.stream().collect(Collectors.toMap(f -> f.getAnnotation(DescriptorValue.class).value(), f -> {
			try {
				return lookup.unreflectVarHandle(f);
			} catch (IllegalAccessException ex) {
				throw new IllegalStateException(ex);
			}
		}));
		meta = fields.stream().collect(Collectors.toMap(f -> f.getAnnotation(DescriptorValue.class).value(), f -> f.getAnnotation(DescriptorValue.class)));
		keys = entries.keySet().toArray(String[]::new);
		Arrays.sort(keys);
		setKeys = new BitSet(keys.length);
	}

	private static List<Field> discoverFields(Class<?> cl) {
		List<Field> fields = new ArrayList<>();
		for (Field field : cl.getFields()) {
			if (!field.isAnnotationPresent(DescriptorValue.class)) continue;
			if (Modifier.isStatic(field.getModifiers())) {
				throw new IllegalStateException("Static field " + field + " has @" + DescriptorValue.class.getSimpleName());
			}
			fields.add(field);
		}
		return fields;
	}

	public String[] getKeys() {
		return keys.clone();
	}

	public boolean hasKey(String key) {
		return entries.containsKey(key);
	}

	public Class<?> getValueType(String key) {
		return entries.get(key).varType();
	}

	public Object getValue(String key) {
		return entries.get(key).get(this);
	}

	public void setValue(String key, Object value) {
		entries.get(key).set(this, value);
		setKeys.set(Arrays.binarySearch(keys, key), value != null);
	}

	public boolean isSet(String key) {
		return setKeys.get(Arrays.binarySearch(keys, key));
	}

	public DescriptorValue getMeta(String key) {
		return meta.get(key);
	}

	/**
	 * @return required keys that were never assigned, sorted
	 */
	public Set<String> missingRequired() {
		Set<String> missing = new LinkedHashSet<>();
		for (int i = 0; i < keys.length; i++) {
			if (!setKeys.get(i) && meta.get(keys[i]).required()) missing.add(keys[i]);
		}
		return missing;
	}
}
