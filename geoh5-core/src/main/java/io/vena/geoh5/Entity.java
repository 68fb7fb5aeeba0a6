package io.vena.geoh5;

import io.vena.geoh5.store.AttributeMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.Getter;
import lombok.NonNull;
import org.jetbrains.annotations.Nullable;

import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;

/**
 * A uid-identified node of a {@link Workspace}'s entity graph:
 * a {@link Group}, an {@link ObjectBase object}, or a {@link Data}.
 *
 * <p>
 * The workspace owns every entity. An entity owns its {@link #children()},
 * but refers to its parent only by uid, resolved through the workspace;
 * once an entity has been {@link Workspace#removeEntity removed},
 * {@link #parent()} is empty.
 *
 * <p>
 * Entities are made through the {@link Workspace} factories, never directly.
 *
 * @param <T> the family of {@link EntityType} this entity carries
 */
public abstract class Entity<T extends EntityType> {
	@Getter private final Workspace workspace;
	@Getter private final UUID uid;
	@Getter private final T entityType;
	@Getter private String name;
	private @Nullable UUID parentUid;
	private final List<Entity<?>> children = new ArrayList<>();

	/**
	 * True if this entity has changes its workspace hasn't saved yet.
	 */
	@Getter private boolean modified = true;

	/**
	 * True if this entity was read from, or has been saved to, its workspace's store.
	 */
	@Getter private boolean existingInStore = false;

	protected Entity(Workspace workspace, UUID uid, String name, T entityType) {
		this.workspace = requireNonNull(workspace);
		this.uid = requireNonNull(uid);
		this.name = requireNonNull(name);
		this.entityType = requireNonNull(entityType);
	}

	public abstract EntityKind kind();

	public void name(@NonNull String newName) {
		name = newName;
		markModified();
	}

	public Optional<Entity<?>> parent() {
		if (parentUid == null) {
			return Optional.empty();
		} else {
			return workspace.findEntity(parentUid);
		}
	}

	public Optional<UUID> parentUid() {
		return Optional.ofNullable(parentUid);
	}

	public List<Entity<?>> children() {
		return unmodifiableList(children);
	}

	protected void markModified() {
		modified = true;
	}

	void markSaved() {
		modified = false;
		existingInStore = true;
	}

	void attachChild(Entity<?> child) {
		assert child.parentUid == null: child + " already has a parent";
		children.add(child);
		child.parentUid = uid;
		markModified();
		child.markModified();
	}

	void detachChild(Entity<?> child) {
		if (children.remove(child)) {
			child.parentUid = null;
			markModified();
		}
	}

	/**
	 * Kind-specific state to persist. Subclasses extend their superclass's map.
	 */
	protected AttributeMap attributes() {
		return AttributeMap.empty();
	}

	/**
	 * Restores the state written by {@link #attributes()}.
	 */
	protected void readAttributes(AttributeMap attributes) { }

	@Override
	public String toString() {
		return getClass().getSimpleName() + "(" + name + ", " + uid + ")";
	}
}
