package io.vena.geoh5;

import io.vena.geoh5.exceptions.InvalidTypeException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static java.util.Arrays.asList;

/**
 * The entity classes this library can rebuild from stored records,
 * looked up by the class id of their stored type.
 */
final class EntityClasses {
	private static final List<EntityClass<GroupType, ? extends Group>> GROUPS = asList(
		ContainerGroup.CLASS
	);

	private static final List<EntityClass<ObjectType, ? extends ObjectBase>> OBJECTS = asList(
		Points.CLASS,
		Curve.CLASS,
		Octree.CLASS
	);

	private static final List<DataClass<? extends Data>> DATA = asList(
		FloatData.CLASS,
		IntegerData.CLASS,
		TextData.CLASS
	);

	/**
	 * Group types nobody registered a class for are read as {@link CustomGroup}s.
	 */
	static EntityClass<GroupType, ? extends Group> groupClass(GroupType type) {
		return find(GROUPS, type.classId()).orElse(CustomGroup.CLASS);
	}

	static EntityClass<ObjectType, ? extends ObjectBase> objectClass(ObjectType type) {
		return find(OBJECTS, type.classId()).orElseThrow(() ->
			new InvalidTypeException("No object class with class id " + type.classId() + " for " + type));
	}

	static DataClass<? extends Data> dataClass(DataType type) {
		return DATA.stream()
			.filter(c -> c.primitiveType() == type.primitiveType())
			.findFirst()
			.orElseThrow(() -> new InvalidTypeException("Unsupported primitive type " + type.primitiveType() + " for " + type));
	}

	private static <C extends EntityClass<?, ?>> Optional<C> find(List<C> classes, UUID classId) {
		return classes.stream()
			.filter(c -> classId.equals(c.identity().typeUid()))
			.findFirst();
	}

	private EntityClasses() { }
}
