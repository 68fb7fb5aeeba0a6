package io.vena.geoh5.store;

import io.vena.geoh5.OctreeCell;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * The persisted container behind a {@link io.vena.geoh5.Workspace}.
 *
 * <p>
 * The workspace reads a {@link ContainerSnapshot} once when it is opened,
 * fetches octree cells lazily, and pushes its modifications in
 * {@link ContainerChanges} batches when saved.
 * The store decides how records are laid out; the workspace never sees bytes.
 */
public interface ContainerStore {
	/**
	 * @return the stored container, or empty if nothing has been committed yet.
	 */
	Optional<ContainerSnapshot> read() throws IOException;

	/**
	 * @return the stored cells of the octree with the given uid;
	 * empty if the store holds none.
	 */
	List<OctreeCell> fetchOctreeCells(UUID octreeUid) throws IOException;

	/**
	 * Applies <code>changes</code> as a unit: deletions, then upserts of types,
	 * then upserts of entities and their cells.
	 */
	void commit(ContainerChanges changes) throws IOException;
}
