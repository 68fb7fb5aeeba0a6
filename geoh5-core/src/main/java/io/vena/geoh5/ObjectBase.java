package io.vena.geoh5;

import io.vena.geoh5.store.AttributeMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.NonNull;
import org.jetbrains.annotations.Nullable;

import static java.util.Collections.unmodifiableList;
import static java.util.UUID.randomUUID;
import static java.util.stream.Collectors.toList;

/**
 * An object: a geometric entity such as a point cloud, a curve, or a mesh,
 * whose children are the {@link Data} channels measured or computed on it,
 * optionally clustered into {@link PropertyGroup}s.
 */
public abstract class ObjectBase extends Entity<ObjectType> {
	private final List<PropertyGroup> propertyGroups = new ArrayList<>();

	protected ObjectBase(Workspace workspace, UUID uid, String name, ObjectType entityType) {
		super(workspace, uid, name, entityType);
	}

	@Override
	public final EntityKind kind() {
		return EntityKind.OBJECT;
	}

	/**
	 * @return this object as an {@link Octree}, if it is one.
	 */
	public Optional<Octree> asOctree() {
		return Optional.empty();
	}

	public List<Data> data() {
		return children().stream()
			.filter(c -> c.kind() == EntityKind.DATA)
			.map(Data.class::cast)
			.collect(toList());
	}

	public List<Data> getData(String name) {
		return data().stream()
			.filter(d -> d.name().equals(name))
			.collect(toList());
	}

	public List<String> dataNames() {
		return data().stream().map(Entity::name).collect(toList());
	}

	public FloatData addFloatData(String name, DataAssociation association, double[] values) {
		return addFloatData(name, association, values, null, null);
	}

	/**
	 * @param sharedType an existing type of this workspace to reuse; if null, the data gets a new type
	 * @param propertyGroup the name of the property group to file the data under, created if need be; may be null
	 */
	public FloatData addFloatData(String name, DataAssociation association, double[] values, @Nullable DataType sharedType, @Nullable String propertyGroup) {
		FloatData result = workspace().createData(FloatData.CLASS, name, this, association, sharedType, propertyGroup);
		result.values(values);
		return result;
	}

	public IntegerData addIntegerData(String name, DataAssociation association, int[] values) {
		return addIntegerData(name, association, values, null, null);
	}

	public IntegerData addIntegerData(String name, DataAssociation association, int[] values, @Nullable DataType sharedType, @Nullable String propertyGroup) {
		IntegerData result = workspace().createData(IntegerData.CLASS, name, this, association, sharedType, propertyGroup);
		result.values(values);
		return result;
	}

	public TextData addTextData(String name, String text) {
		TextData result = workspace().createData(TextData.CLASS, name, this, DataAssociation.OBJECT, null, null);
		result.text(text);
		return result;
	}

	public List<PropertyGroup> propertyGroups() {
		return unmodifiableList(propertyGroups);
	}

	public Optional<PropertyGroup> findPropertyGroup(String name) {
		return propertyGroups.stream()
			.filter(g -> g.name().equals(name))
			.findFirst();
	}

	public PropertyGroup findOrCreatePropertyGroup(@NonNull String name) {
		Optional<PropertyGroup> existing = findPropertyGroup(name);
		if (existing.isPresent()) {
			return existing.get();
		}
		PropertyGroup result = new PropertyGroup(randomUUID(), name);
		propertyGroups.add(result);
		markModified();
		return result;
	}

	/**
	 * Files <code>data</code>, which must be a child of this object,
	 * under the named property group, creating the group if need be.
	 */
	public PropertyGroup addDataToGroup(@NonNull Data data, @NonNull String groupName) {
		if (!children().contains(data)) {
			throw new IllegalArgumentException(data + " is not a child of " + this);
		}
		PropertyGroup group = findOrCreatePropertyGroup(groupName);
		if (group.addProperty(data)) {
			markModified();
		}
		return group;
	}

	public boolean removePropertyGroup(String name) {
		boolean removed = propertyGroups.removeIf(g -> g.name().equals(name));
		if (removed) {
			markModified();
		}
		return removed;
	}

	void purgeFromPropertyGroups(UUID dataUid) {
		for (PropertyGroup group: propertyGroups) {
			if (group.removeProperty(dataUid)) {
				markModified();
			}
		}
	}

	@Override
	protected AttributeMap attributes() {
		if (propertyGroups.isEmpty()) {
			return super.attributes();
		} else {
			return super.attributes().with(PROPERTY_GROUPS, propertyGroups.stream()
				.map(PropertyGroup::attributes)
				.collect(toList()));
		}
	}

	@Override
	protected void readAttributes(AttributeMap attributes) {
		super.readAttributes(attributes);
		propertyGroups.clear();
		attributes.maps(PROPERTY_GROUPS).forEach(m -> propertyGroups.add(PropertyGroup.fromAttributes(m)));
	}

	private static final String PROPERTY_GROUPS = "PropertyGroups";
}
