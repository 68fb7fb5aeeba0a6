package io.vena.geoh5;

import io.vena.geoh5.exceptions.ContainerStoreException;
import io.vena.geoh5.exceptions.InvalidTypeException;
import io.vena.geoh5.exceptions.MissingParentException;
import io.vena.geoh5.exceptions.NoActiveWorkspaceException;
import io.vena.geoh5.store.AttributeMap;
import io.vena.geoh5.store.ContainerChanges;
import io.vena.geoh5.store.ContainerSnapshot;
import io.vena.geoh5.store.ContainerStore;
import io.vena.geoh5.store.EntityRecord;
import java.io.IOException;
import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Stream;
import lombok.Getter;
import lombok.NonNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Collections.emptyList;
import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableMap;
import static java.util.UUID.randomUUID;
import static java.util.stream.Collectors.toList;
import static java.util.stream.Collectors.toSet;

/**
 * The registry owning the entity graph of one geoh5 container:
 * every {@link EntityType}, {@link Group}, {@link ObjectBase object} and {@link Data},
 * each kept in its own collection keyed by uid, plus the {@link RootGroup}.
 *
 * <p>
 * Entities are made by this class's factories, which resolve the entity's
 * type, construct it, register it, and attach it to its parent;
 * they're removed by {@link #removeEntity}, which cascades to children and
 * evicts types no remaining entity refers to.
 *
 * <p>
 * A workspace optionally sits on a {@link ContainerStore}. It reads the store
 * once when {@link #open opened}, and writes its pending changes on
 * {@link #save()} and {@link #close()}.
 *
 * <p>
 * A workspace is meant to be used from one thread at a time; none of its
 * collections are synchronized.
 *
 * <p>
 * Callers should pass their workspace explicitly. For code that needs an
 * ambient "current" workspace, there is a process-wide {@link #active() active workspace}
 * which never keeps its workspace from being garbage-collected,
 * and which is best set with a scoped {@link #activation()}.
 */
public class Workspace implements AutoCloseable {
	@Getter private final WorkspaceSettings settings;
	private final @Nullable ContainerStore store;
	@Getter private double version;
	@Getter private String distanceUnit;
	private List<String> contributors;

	private final Map<UUID, EntityType> types = new LinkedHashMap<>();
	private final Map<UUID, Group> groups = new LinkedHashMap<>();
	private final Map<UUID, ObjectBase> objects = new LinkedHashMap<>();
	private final Map<UUID, Data> data = new LinkedHashMap<>();
	@Getter private final RootGroup root;

	private final Set<UUID> deletedEntities = new LinkedHashSet<>();
	private final Set<UUID> deletedTypes = new LinkedHashSet<>();
	private boolean closed = false;

	public Workspace() {
		this(WorkspaceSettings.defaults());
	}

	public Workspace(WorkspaceSettings settings) {
		this(settings, null);
	}

	/**
	 * Makes an empty workspace with a new root group.
	 * Anything already in <code>store</code> is overwritten by the first save;
	 * use {@link #open} to continue from the store's contents instead.
	 */
	public Workspace(@NonNull WorkspaceSettings settings, @Nullable ContainerStore store) {
		this(settings, store, ws -> ws.createRoot());
	}

	private Workspace(WorkspaceSettings settings, @Nullable ContainerStore store, Function<Workspace, RootGroup> rootFunction) {
		this.settings = settings;
		this.store = store;
		this.version = settings.version();
		this.distanceUnit = settings.distanceUnit();
		this.contributors = new ArrayList<>(settings.contributors());
		this.root = rootFunction.apply(this);
	}

	public static Workspace open(ContainerStore store) throws IOException {
		return open(store, WorkspaceSettings.defaults());
	}

	/**
	 * Opens the container held in <code>store</code>, or starts a new one
	 * if the store is empty.
	 */
	public static Workspace open(@NonNull ContainerStore store, @NonNull WorkspaceSettings settings) throws IOException {
		Optional<ContainerSnapshot> snapshot = store.read();
		if (snapshot.isPresent()) {
			LOGGER.debug("Opening container with {} types and {} entities",
				snapshot.get().types().size(),
				snapshot.get().entities().size());
			return new Workspace(settings, store, ws -> ws.load(snapshot.get()));
		} else {
			LOGGER.debug("Store is empty; starting a new container");
			return new Workspace(settings, store);
		}
	}

	public List<String> contributors() {
		return unmodifiableList(contributors);
	}

	public Optional<ContainerStore> store() {
		return Optional.ofNullable(store);
	}

	///////////////////////
	//
	//  Active workspace
	//

	/**
	 * Makes this workspace the active one. If this workspace is later garbage-collected
	 * without being deactivated, there is simply no active workspace.
	 */
	public void activate() {
		if (activeRef.get() != this) {
			LOGGER.trace("Activating {}", this);
			activeRef = new WeakReference<>(this);
		}
	}

	/**
	 * Deactivates this workspace if it is the active one; otherwise does nothing.
	 */
	public void deactivate() {
		if (activeRef.get() == this) {
			LOGGER.trace("Deactivating {}", this);
			activeRef = NO_WORKSPACE;
		}
	}

	/**
	 * @throws NoActiveWorkspaceException if no workspace is active,
	 * or the active one has been garbage-collected
	 */
	public static Workspace active() {
		Workspace result = activeRef.get();
		if (result == null) {
			throw new NoActiveWorkspaceException("No active workspace");
		}
		return result;
	}

	public static Optional<Workspace> activeIfPresent() {
		return Optional.ofNullable(activeRef.get());
	}

	/**
	 * A scope during which a workspace is the active one.
	 * Closing it restores whichever workspace was active before, or none,
	 * regardless of any activations made inside the scope.
	 *
	 * <p>
	 * Activations must be closed in reverse order of creation;
	 * use them in <i>try-with-resources</i> statements.
	 */
	public final class Activation implements AutoCloseable {
		final WeakReference<Workspace> previous = activeRef;

		private Activation() {
			activate();
		}

		@Override
		public void close() {
			activeRef = previous;
			LOGGER.trace("Exiting activation of {}; restored {}", Workspace.this, previous.get());
		}
	}

	public Activation activation() {
		return new Activation();
	}

	///////////////////////
	//
	//  Types
	//

	/**
	 * Registers <code>type</code> under its uid, replacing any type already there.
	 * To avoid accidental replacement, get types from the find-or-create
	 * methods of the {@link EntityType} subclasses.
	 */
	public void registerType(@NonNull EntityType type) {
		EntityType previous = types.put(type.uid(), type);
		if (previous != null && previous != type) {
			LOGGER.warn("Replacing {} with {}", previous, type);
		}
	}

	/**
	 * @return the type with the given uid if there is one and it's a <code>typeClass</code>
	 */
	public <TT extends EntityType> Optional<TT> findType(@NonNull UUID uid, @NonNull Class<TT> typeClass) {
		EntityType found = types.get(uid);
		if (typeClass.isInstance(found)) {
			return Optional.of(typeClass.cast(found));
		} else {
			return Optional.empty();
		}
	}

	public Map<UUID, EntityType> types() {
		return unmodifiableMap(types);
	}

	///////////////////////
	//
	//  Registration and lookup
	//

	public void registerGroup(@NonNull Group group) {
		warnIfReplaced(groups.put(group.uid(), group), group);
	}

	public void registerObject(@NonNull ObjectBase object) {
		warnIfReplaced(objects.put(object.uid(), object), object);
	}

	public void registerData(@NonNull Data entity) {
		warnIfReplaced(data.put(entity.uid(), entity), entity);
	}

	private void register(Entity<?> entity) {
		switch (entity.kind()) {
			case GROUP:
				registerGroup((Group) entity);
				break;
			case OBJECT:
				registerObject((ObjectBase) entity);
				break;
			case DATA:
				registerData((Data) entity);
				break;
		}
	}

	private static void warnIfReplaced(@Nullable Entity<?> previous, Entity<?> entity) {
		if (previous != null && previous != entity) {
			LOGGER.warn("Replacing {} with {}", previous, entity);
		}
	}

	public Map<UUID, Group> groups() {
		return unmodifiableMap(groups);
	}

	public Map<UUID, ObjectBase> objects() {
		return unmodifiableMap(objects);
	}

	public Map<UUID, Data> data() {
		return unmodifiableMap(data);
	}

	public Optional<Group> findGroup(UUID uid) {
		return Optional.ofNullable(groups.get(uid));
	}

	public Optional<ObjectBase> findObject(UUID uid) {
		return Optional.ofNullable(objects.get(uid));
	}

	public Optional<Data> findData(UUID uid) {
		return Optional.ofNullable(data.get(uid));
	}

	public Optional<Entity<?>> findEntity(UUID uid) {
		Entity<?> result = groups.get(uid);
		if (result == null) {
			result = objects.get(uid);
		}
		if (result == null) {
			result = data.get(uid);
		}
		return Optional.ofNullable(result);
	}

	/**
	 * @return every entity with the given name, groups first, then objects, then data
	 */
	public List<Entity<?>> getEntities(String name) {
		return allEntities()
			.filter(e -> e.name().equals(name))
			.collect(toList());
	}

	public boolean isRegistered(Entity<?> entity) {
		switch (entity.kind()) {
			case GROUP: return groups.get(entity.uid()) == entity;
			case OBJECT: return objects.get(entity.uid()) == entity;
			case DATA: return data.get(entity.uid()) == entity;
			default: throw new AssertionError("Unexpected kind: " + entity.kind());
		}
	}

	private Stream<Entity<?>> allEntities() {
		return Stream.<Collection<? extends Entity<?>>>of(groups.values(), objects.values(), data.values())
			.flatMap(Collection::stream);
	}

	///////////////////////
	//
	//  Factories
	//

	/**
	 * @param parent defaults to {@link #root()} if null
	 * @throws MissingParentException if <code>parent</code> isn't registered in this workspace
	 * @throws InvalidTypeException if <code>groupClass</code> declares no type uid
	 */
	public <G extends Group> G createGroup(@NonNull EntityClass<GroupType, G> groupClass, @NonNull String name, @Nullable Group parent) {
		Entity<?> resolvedParent = resolveParent(parent);
		return create(groupClass, GroupType.findOrCreate(this, groupClass), name, resolvedParent);
	}

	/**
	 * Creates a group of a new {@link GroupType#createCustom custom type}.
	 */
	public CustomGroup createCustomGroup(@Nullable String typeName, @Nullable String typeDescription, @NonNull String name, @Nullable Group parent) {
		Entity<?> resolvedParent = resolveParent(parent);
		return create(CustomGroup.CLASS, GroupType.createCustom(this, typeName, typeDescription), name, resolvedParent);
	}

	/**
	 * @param parent defaults to {@link #root()} if null
	 * @throws MissingParentException if <code>parent</code> isn't registered in this workspace
	 * @throws InvalidTypeException if <code>objectClass</code> declares no type uid
	 */
	public <O extends ObjectBase> O createObject(@NonNull EntityClass<ObjectType, O> objectClass, @NonNull String name, @Nullable Group parent) {
		Entity<?> resolvedParent = resolveParent(parent);
		return create(objectClass, ObjectType.findOrCreate(this, objectClass), name, resolvedParent);
	}

	/**
	 * @param sharedType a data type of this workspace to reuse; if null, the data gets a new type
	 * @param propertyGroup the name of a property group of <code>parent</code> to add the data to,
	 *                      created if need be; if null, the data joins no property group
	 * @throws MissingParentException if <code>parent</code> isn't registered in this workspace
	 */
	public <D extends Data> D createData(
		@NonNull DataClass<D> dataClass,
		@NonNull String name,
		@NonNull ObjectBase parent,
		@NonNull DataAssociation association,
		@Nullable DataType sharedType,
		@Nullable String propertyGroup
	) {
		Entity<?> resolvedParent = resolveParent(parent);
		DataType type;
		if (sharedType == null) {
			type = DataType.create(this, dataClass.primitiveType(), name, null);
		} else if (types.get(sharedType.uid()) != sharedType) {
			throw new IllegalArgumentException(sharedType + " does not belong to " + this);
		} else if (sharedType.primitiveType() != dataClass.primitiveType()) {
			throw new IllegalArgumentException("Can't share " + sharedType + " of primitive type " + sharedType.primitiveType()
				+ " with " + dataClass.javaClass().getSimpleName());
		} else {
			type = sharedType;
		}
		D result = create(dataClass, type, name, resolvedParent);
		result.association(association);
		if (propertyGroup != null) {
			parent.addDataToGroup(result, propertyGroup);
		}
		return result;
	}

	private <T extends EntityType, E extends Entity<T>> E create(EntityClass<T, E> entityClass, T type, String name, Entity<?> parent) {
		E result = entityClass.constructor().construct(this, randomUUID(), name, type);
		register(result);
		parent.attachChild(result);
		LOGGER.debug("Created {} in {}", result, parent);
		return result;
	}

	private Entity<?> resolveParent(@Nullable Entity<?> parent) {
		requireOpen();
		if (parent == null) {
			return root;
		} else if (parent.workspace() != this || !isRegistered(parent)) {
			throw new MissingParentException(parent + " is not in " + this);
		} else {
			return parent;
		}
	}

	private RootGroup createRoot() {
		RootGroup result = RootGroup.CLASS.constructor().construct(this, randomUUID(), RootGroup.DEFAULT_NAME, GroupType.findOrCreate(this, RootGroup.CLASS));
		registerGroup(result);
		return result;
	}

	/**
	 * Copies <code>source</code>, which belongs to another workspace, into this one
	 * along with all its descendants, keeping their uids.
	 * Types are matched by uid: a type this workspace already has is reused.
	 *
	 * @param parent defaults to {@link #root()} if null; required for {@link Data}
	 * @return the copy of <code>source</code>
	 * @throws InvalidTypeException if a type in the copied subtree has the uid
	 * of a different kind of type here; nothing is copied in that case
	 */
	@SuppressWarnings("unchecked")
	public <E extends Entity<?>> E copyEntity(@NonNull E source, @Nullable Entity<?> parent) {
		if (source.workspace() == this) {
			throw new IllegalArgumentException(source + " already belongs to " + this);
		} else if (source == source.workspace().root()) {
			throw new IllegalArgumentException("Can't copy the root group of another workspace");
		} else if (findEntity(source.uid()).isPresent()) {
			throw new IllegalArgumentException(this + " already has an entity with uid " + source.uid());
		}
		Entity<?> resolvedParent = resolveParent(parent);
		EntityKind requiredParentKind = (source.kind() == EntityKind.DATA) ? EntityKind.OBJECT : EntityKind.GROUP;
		if (resolvedParent.kind() != requiredParentKind) {
			throw new IllegalArgumentException("Parent of " + source + " must be of kind " + requiredParentKind + "; got " + resolvedParent);
		}
		checkTypesAdoptable(source);
		Entity<?> result = copyRecursively(source, resolvedParent);
		LOGGER.debug("Copied {} from {} into {}", source, source.workspace(), this);
		return (E) result;
	}

	/**
	 * @throws InvalidTypeException if some type in the subtree shares its uid
	 * with a type of a different kind in this workspace
	 */
	private void checkTypesAdoptable(Entity<?> source) {
		EntityType sourceType = source.entityType();
		EntityType existing = types.get(sourceType.uid());
		if (existing != null && existing.kind() != sourceType.kind()) {
			throw new InvalidTypeException("Type " + sourceType.uid() + " of " + source
				+ " is already registered here as a " + existing.kind() + " type");
		}
		for (Entity<?> child: source.children()) {
			checkTypesAdoptable(child);
		}
	}

	private Entity<?> copyRecursively(Entity<?> source, Entity<?> parent) {
		EntityType type = adoptType(source.entityType());
		Entity<?> result = ContainerRecords.entityFromRecord(this, ContainerRecords.toRecord(source), type);
		register(result);
		parent.attachChild(result);
		if (source.kind() == EntityKind.OBJECT) {
			Optional<List<OctreeCell>> cells = ((ObjectBase) source).asOctree().flatMap(Octree::currentCells);
			if (cells.isPresent()) {
				((ObjectBase) result).asOctree().ifPresent(o -> o.octreeCells(cells.get()));
			}
		}
		for (Entity<?> child: source.children()) {
			copyRecursively(child, result);
		}
		return result;
	}

	private EntityType adoptType(EntityType sourceType) {
		EntityType existing = types.get(sourceType.uid());
		if (existing != null) {
			return existing;
		}
		EntityType result = ContainerRecords.typeFromRecord(this, ContainerRecords.toRecord(sourceType));
		registerType(result);
		return result;
	}

	///////////////////////
	//
	//  Removal
	//

	/**
	 * Removes <code>entity</code> and all its descendants from this workspace.
	 * Removed data are purged from the property groups of their parent objects.
	 * Afterward, any type that was used by a removed entity and is no longer
	 * used by any registered entity is removed too.
	 *
	 * <p>
	 * Removing an entity that isn't in this workspace, including one that was
	 * already removed, does nothing.
	 *
	 * @throws IllegalArgumentException if <code>entity</code> is the root group
	 */
	public void removeEntity(@NonNull Entity<?> entity) {
		if (entity == root) {
			throw new IllegalArgumentException("Can't remove the root group");
		} else if (entity.workspace() != this || !isRegistered(entity)) {
			LOGGER.debug("Ignoring removal of {}; not in {}", entity, this);
			return;
		}
		Set<EntityType> candidateTypes = new LinkedHashSet<>();
		removeRecursively(entity, candidateTypes);
		evictUnusedTypes(candidateTypes);
	}

	private void removeRecursively(Entity<?> entity, Set<EntityType> candidateTypes) {
		for (Entity<?> child: new ArrayList<>(entity.children())) {
			removeRecursively(child, candidateTypes);
		}
		Optional<Entity<?>> parent = entity.parent();
		if (parent.isPresent()) {
			Entity<?> p = parent.get();
			if (entity.kind() == EntityKind.DATA && p.kind() == EntityKind.OBJECT) {
				((ObjectBase) p).purgeFromPropertyGroups(entity.uid());
			}
			p.detachChild(entity);
		}
		switch (entity.kind()) {
			case GROUP:
				groups.remove(entity.uid());
				break;
			case OBJECT:
				objects.remove(entity.uid());
				break;
			case DATA:
				data.remove(entity.uid());
				break;
		}
		candidateTypes.add(entity.entityType());
		if (entity.existingInStore()) {
			deletedEntities.add(entity.uid());
		}
		LOGGER.debug("Removed {}", entity);
	}

	private void evictUnusedTypes(Set<EntityType> candidateTypes) {
		Set<UUID> usedTypes = allEntities()
			.map(e -> e.entityType().uid())
			.collect(toSet());
		for (EntityType type: candidateTypes) {
			if (!usedTypes.contains(type.uid()) && types.get(type.uid()) == type) {
				types.remove(type.uid());
				deletedTypes.add(type.uid());
				LOGGER.debug("Evicted unused {}", type);
			}
		}
	}

	///////////////////////
	//
	//  Persistence
	//

	/**
	 * Reads the cells of the stored octree with the given uid.
	 *
	 * @return the stored cells, or an empty list if this workspace has no store
	 * @throws ContainerStoreException if the store fails
	 */
	public List<OctreeCell> fetchOctreeCells(@NonNull UUID octreeUid) {
		if (store == null) {
			return emptyList();
		}
		try {
			return store.fetchOctreeCells(octreeUid);
		} catch (IOException e) {
			throw new ContainerStoreException("Unable to fetch cells of octree " + octreeUid, e);
		}
	}

	/**
	 * Writes to the store every type and entity modified since the last save,
	 * along with the removals made since then.
	 * Does nothing if this workspace has no store.
	 */
	public void save() throws IOException {
		requireOpen();
		if (store == null) {
			LOGGER.debug("{} has no store; nothing to save", this);
			return;
		}
		List<Entity<?>> modifiedEntities = new ArrayList<>();
		Map<UUID, List<OctreeCell>> modifiedCells = new LinkedHashMap<>();
		collectModified(root, modifiedEntities, modifiedCells);
		List<EntityType> modifiedTypes = types.values().stream()
			.filter(EntityType::modified)
			.collect(toList());

		ContainerChanges changes = ContainerChanges.builder()
			.workspaceAttributes(workspaceAttributes())
			.types(modifiedTypes.stream().map(ContainerRecords::toRecord).collect(toList()))
			.entities(modifiedEntities.stream().map(ContainerRecords::toRecord).collect(toList()))
			.octreeCells(modifiedCells)
			.deletedEntities(new LinkedHashSet<>(deletedEntities))
			.deletedTypes(new LinkedHashSet<>(deletedTypes))
			.build();
		store.commit(changes);

		modifiedTypes.forEach(EntityType::markSaved);
		modifiedEntities.forEach(Entity::markSaved);
		deletedEntities.clear();
		deletedTypes.clear();
		LOGGER.debug("Saved {}: {} types, {} entities", this, modifiedTypes.size(), modifiedEntities.size());
	}

	/**
	 * Parents precede their children.
	 */
	private void collectModified(Entity<?> entity, List<Entity<?>> modifiedEntities, Map<UUID, List<OctreeCell>> modifiedCells) {
		if (entity.modified()) {
			modifiedEntities.add(entity);
		}
		if (entity.kind() == EntityKind.OBJECT) {
			((ObjectBase) entity).asOctree()
				.filter(Octree::cellsModified)
				.ifPresent(o -> modifiedCells.put(o.uid(), o.octreeCells()));
		}
		for (Entity<?> child: entity.children()) {
			collectModified(child, modifiedEntities, modifiedCells);
		}
	}

	private RootGroup load(ContainerSnapshot snapshot) {
		readWorkspaceAttributes(snapshot.workspaceAttributes());
		snapshot.types().forEach(record -> registerType(ContainerRecords.typeFromRecord(this, record)));
		RootGroup loadedRoot = null;
		for (EntityRecord record: snapshot.entities()) {
			EntityType type = types.get(record.typeUid());
			if (type == null) {
				throw new InvalidTypeException("Entity \"" + record.name() + "\" refers to missing type " + record.typeUid());
			}
			UUID parentUid = record.parentUid();
			if (parentUid == null) {
				if (loadedRoot != null) {
					throw new IllegalArgumentException("Container has two root groups: " + loadedRoot + " and " + record.name());
				}
				loadedRoot = ContainerRecords.rootFromRecord(this, record, type);
				registerGroup(loadedRoot);
			} else {
				Entity<?> parent = findEntity(parentUid).orElseThrow(() ->
					new MissingParentException("Parent " + parentUid + " of \"" + record.name() + "\" is not in the container"));
				Entity<?> entity = ContainerRecords.entityFromRecord(this, record, type);
				register(entity);
				parent.attachChild(entity);
			}
		}
		if (loadedRoot == null) {
			throw new IllegalArgumentException("Container has no root group");
		}
		types.values().forEach(EntityType::markSaved);
		allEntities().forEach(Entity::markSaved);
		return loadedRoot;
	}

	private AttributeMap workspaceAttributes() {
		return AttributeMap.empty()
			.with(VERSION, version)
			.with(DISTANCE_UNIT, distanceUnit)
			.with(CONTRIBUTORS, contributors);
	}

	private void readWorkspaceAttributes(AttributeMap attributes) {
		attributes.number(VERSION).ifPresent(v -> version = v);
		attributes.string(DISTANCE_UNIT).ifPresent(u -> distanceUnit = u);
		List<String> storedContributors = attributes.strings(CONTRIBUTORS);
		if (!storedContributors.isEmpty()) {
			contributors = new ArrayList<>(storedContributors);
		}
	}

	/**
	 * Saves pending changes if the {@link WorkspaceSettings#saveOnClose() settings} say so,
	 * deactivates this workspace, and releases the entity graph.
	 * Closing a closed workspace does nothing.
	 */
	@Override
	public void close() throws IOException {
		if (closed) {
			return;
		}
		try {
			if (store != null && settings.saveOnClose()) {
				save();
			}
		} finally {
			deactivate();
			data.clear();
			objects.clear();
			groups.clear();
			types.clear();
			closed = true;
			LOGGER.debug("Closed {}", this);
		}
	}

	public boolean isClosed() {
		return closed;
	}

	private void requireOpen() {
		if (closed) {
			throw new IllegalStateException(this + " is closed");
		}
	}

	@Override
	public String toString() {
		return "Workspace@" + Integer.toHexString(System.identityHashCode(this));
	}

	private static final WeakReference<Workspace> NO_WORKSPACE = new WeakReference<>(null);
	private static volatile WeakReference<Workspace> activeRef = NO_WORKSPACE;

	private static final String VERSION = "Version";
	private static final String DISTANCE_UNIT = "Distance unit";
	private static final String CONTRIBUTORS = "Contributors";

	private static final Logger LOGGER = LoggerFactory.getLogger(Workspace.class);
}
