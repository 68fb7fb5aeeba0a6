package io.vena.geoh5;

import io.vena.geoh5.store.AttributeMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import lombok.Getter;

import static java.util.Collections.unmodifiableSet;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.toList;

/**
 * A named, ordered set of {@link Data} uids clustering related channels
 * of one {@link ObjectBase object}, such as "Observed" and "Uncertainties".
 *
 * <p>
 * Every listed uid refers to a live data child of the owning object:
 * membership goes through {@link ObjectBase#addDataToGroup}, and the
 * {@link Workspace} purges a data's uid from every group when it removes the data.
 */
public final class PropertyGroup {
	@Getter private final UUID uid;
	@Getter private final String name;
	@Getter private DataAssociation association = DataAssociation.VERTEX;
	@Getter private String propertyGroupType = DEFAULT_GROUP_TYPE;
	private final Set<UUID> properties = new LinkedHashSet<>();

	PropertyGroup(UUID uid, String name) {
		this.uid = requireNonNull(uid);
		this.name = requireNonNull(name);
	}

	public Set<UUID> properties() {
		return unmodifiableSet(properties);
	}

	public boolean contains(UUID dataUid) {
		return properties.contains(dataUid);
	}

	boolean addProperty(Data data) {
		if (properties.isEmpty()) {
			association = data.association();
		}
		return properties.add(data.uid());
	}

	boolean removeProperty(UUID dataUid) {
		return properties.remove(dataUid);
	}

	AttributeMap attributes() {
		return AttributeMap.empty()
			.with(ID, uid)
			.with(NAME, name)
			.with(ASSOCIATION, association)
			.with(GROUP_TYPE, propertyGroupType)
			.with(PROPERTIES, properties.stream().map(UUID::toString).collect(toList()));
	}

	static PropertyGroup fromAttributes(AttributeMap attributes) {
		PropertyGroup result = new PropertyGroup(
			attributes.uuid(ID).orElseThrow(() -> new IllegalArgumentException("Property group has no " + ID)),
			attributes.string(NAME).orElseThrow(() -> new IllegalArgumentException("Property group has no " + NAME)));
		attributes.string(ASSOCIATION).map(DataAssociation::valueOf).ifPresent(a -> result.association = a);
		attributes.string(GROUP_TYPE).ifPresent(t -> result.propertyGroupType = t);
		List<String> uids = attributes.strings(PROPERTIES);
		uids.forEach(s -> result.properties.add(UUID.fromString(s)));
		return result;
	}

	@Override
	public String toString() {
		return "PropertyGroup(" + name + ", " + properties.size() + " properties)";
	}

	public static final String DEFAULT_GROUP_TYPE = "Multi-element";

	private static final String ID = "ID";
	private static final String NAME = "Name";
	private static final String ASSOCIATION = "Association";
	private static final String GROUP_TYPE = "Property Group Type";
	private static final String PROPERTIES = "Properties";
}
