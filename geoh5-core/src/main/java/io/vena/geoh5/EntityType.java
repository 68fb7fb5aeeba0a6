package io.vena.geoh5;

import io.vena.geoh5.exceptions.InvalidTypeException;
import io.vena.geoh5.store.AttributeMap;
import java.util.Optional;
import java.util.UUID;
import lombok.Getter;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Identity and metadata shared by all the entities of one concrete kind
 * within one {@link Workspace}.
 *
 * <p>
 * There is at most one <code>EntityType</code> per uid in a workspace.
 * Types are owned by the workspace's registry, not by the entities that use them:
 * the workspace evicts a type when the last entity referencing it is removed.
 *
 * <p>
 * <b>Note</b>: {@link #classId} identifies which concrete entity class the type denotes,
 * independently of {@link #uid}. When no class id was given, it defaults to the uid.
 */
public abstract class EntityType {
	@Getter private final Workspace workspace;
	@Getter private final UUID uid;
	@Nullable private final UUID classId;
	@Getter private final @Nullable String name;
	@Getter private final @Nullable String description;
	@Getter private boolean modified = true;

	protected EntityType(Workspace workspace, UUID uid, @Nullable String name, @Nullable String description, @Nullable UUID classId) {
		this.workspace = requireNonNull(workspace);
		this.uid = requireNonNull(uid);
		this.name = name;
		this.description = description;
		this.classId = classId;
	}

	public abstract EntityKind kind();

	public UUID classId() {
		return classId != null ? classId : uid;
	}

	/**
	 * @return true if a class id was given explicitly rather than defaulted from the uid.
	 */
	public boolean hasExplicitClassId() {
		return classId != null;
	}

	protected void markModified() {
		modified = true;
	}

	void markSaved() {
		modified = false;
	}

	/**
	 * Kind-specific metadata to persist alongside the common fields.
	 */
	protected AttributeMap attributes() {
		return AttributeMap.empty();
	}

	protected void readAttributes(AttributeMap attributes) { }

	@FunctionalInterface
	protected interface TypeConstructor<TT extends EntityType> {
		TT construct(Workspace workspace, UUID uid, @Nullable String name, @Nullable String description, @Nullable UUID classId);
	}

	/**
	 * Returns the type with the identity's uid if the workspace already has one
	 * of the requested class; otherwise constructs one and registers it.
	 *
	 * @throws InvalidTypeException if the identity has no type uid
	 */
	protected static <TT extends EntityType> TT findOrCreate(Workspace workspace, Class<TT> typeClass, TypeIdentity identity, TypeConstructor<TT> constructor) {
		UUID typeUid = identity.typeUid();
		if (typeUid == null || NIL_UID.equals(typeUid)) {
			throw new InvalidTypeException("Cannot create " + typeClass.getSimpleName() + " with null UUID for \"" + identity.name() + "\"");
		}
		Optional<TT> existing = workspace.findType(typeUid, typeClass);
		if (existing.isPresent()) {
			return existing.get();
		}
		TT created = constructor.construct(workspace, typeUid, identity.name(), identity.description(), identity.classId());
		workspace.registerType(created);
		LOGGER.debug("Created {}", created);
		return created;
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "(" + name + ", " + uid + ")";
	}

	static final UUID NIL_UID = new UUID(0, 0);
	private static final Logger LOGGER = LoggerFactory.getLogger(EntityType.class);
}
