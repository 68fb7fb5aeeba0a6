package io.vena.geoh5;

import io.vena.geoh5.exceptions.InvalidTypeException;
import io.vena.geoh5.store.EntityRecord;
import io.vena.geoh5.store.TypeRecord;

/**
 * Converts between live types and entities and the records a
 * {@link io.vena.geoh5.store.ContainerStore} keeps.
 */
final class ContainerRecords {
	static TypeRecord toRecord(EntityType type) {
		return new TypeRecord(
			type.uid(),
			type.kind(),
			type.hasExplicitClassId() ? type.classId() : null,
			type.name(),
			type.description(),
			type.attributes());
	}

	static EntityRecord toRecord(Entity<?> entity) {
		return new EntityRecord(
			entity.uid(),
			entity.kind(),
			entity.entityType().uid(),
			entity.parentUid().orElse(null),
			entity.name(),
			entity.attributes());
	}

	/**
	 * Builds the type described by <code>record</code>. The caller registers it.
	 */
	static EntityType typeFromRecord(Workspace workspace, TypeRecord record) {
		EntityType result;
		switch (record.kind()) {
			case GROUP:
				result = new GroupType(workspace, record.uid(), record.name(), record.description(), record.classId());
				break;
			case OBJECT:
				result = new ObjectType(workspace, record.uid(), record.name(), record.description(), record.classId());
				break;
			case DATA:
				result = new DataType(workspace, record.uid(), record.name(), record.description(), record.classId());
				break;
			default:
				throw new AssertionError("Unexpected kind: " + record.kind());
		}
		result.readAttributes(record.attributes());
		return result;
	}

	/**
	 * Builds the entity described by <code>record</code>, of the class its type denotes.
	 * The caller registers it and attaches it to its parent.
	 */
	static Entity<?> entityFromRecord(Workspace workspace, EntityRecord record, EntityType type) {
		checkKind(record, type);
		Entity<?> result;
		switch (record.kind()) {
			case GROUP: {
				GroupType groupType = (GroupType) type;
				result = EntityClasses.groupClass(groupType).constructor().construct(workspace, record.uid(), record.name(), groupType);
				break;
			}
			case OBJECT: {
				ObjectType objectType = (ObjectType) type;
				result = EntityClasses.objectClass(objectType).constructor().construct(workspace, record.uid(), record.name(), objectType);
				break;
			}
			case DATA: {
				DataType dataType = (DataType) type;
				result = EntityClasses.dataClass(dataType).constructor().construct(workspace, record.uid(), record.name(), dataType);
				break;
			}
			default:
				throw new AssertionError("Unexpected kind: " + record.kind());
		}
		result.readAttributes(record.attributes());
		return result;
	}

	static RootGroup rootFromRecord(Workspace workspace, EntityRecord record, EntityType type) {
		checkKind(record, type);
		if (record.kind() != EntityKind.GROUP) {
			throw new InvalidTypeException("Root entity must be a group: " + record.name());
		}
		RootGroup result = RootGroup.CLASS.constructor().construct(workspace, record.uid(), record.name(), (GroupType) type);
		result.readAttributes(record.attributes());
		return result;
	}

	private static void checkKind(EntityRecord record, EntityType type) {
		if (record.kind() != type.kind()) {
			throw new InvalidTypeException("Entity \"" + record.name() + "\" of kind " + record.kind() + " has type " + type + " of kind " + type.kind());
		}
	}

	private ContainerRecords() { }
}
