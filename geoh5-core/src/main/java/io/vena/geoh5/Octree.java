package io.vena.geoh5;

import io.vena.geoh5.store.AttributeMap;
import java.util.AbstractList;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.RandomAccess;
import java.util.UUID;
import javax.vecmath.Matrix3d;
import javax.vecmath.Point3d;
import javax.vecmath.Tuple3d;
import lombok.NonNull;
import org.jetbrains.annotations.Nullable;

import static java.util.Collections.unmodifiableList;

/**
 * A mesh whose cubic cells can each be subdivided into eight octants.
 *
 * <p>
 * The base grid has {@link #uCount}, {@link #vCount} and {@link #wCount} cells
 * (powers of two) along its u, v and w axes, each of size {@link #uCellSize},
 * {@link #vCellSize} and {@link #wCellSize}. The grid sits at {@link #origin},
 * rotated by {@link #rotation} degrees about the vertical axis.
 * {@link #octreeCells} lists the actual cells, addressed on the base grid.
 *
 * <p>
 * A new octree without explicit cells is {@link #baseRefine() base-refined}
 * the first time its cells are read. An octree read from a store fetches
 * its cells from the store instead, the first time they're read.
 *
 * <p>
 * {@link #centroids()} are computed on demand and cached; every setter
 * of a parameter they depend on clears the cache.
 */
public final class Octree extends ObjectBase {
	public static final TypeIdentity TYPE_IDENTITY = TypeIdentity.of(
		UUID.fromString("4ea87376-3ece-438b-bf12-3479733ded46"),
		"Octree",
		"Octree");

	public static final EntityClass<ObjectType, Octree> CLASS = new EntityClass<>(Octree.class, TYPE_IDENTITY, Octree::new);

	private final Point3d origin = new Point3d();
	private double rotation = 0.0;
	private @Nullable Integer uCount;
	private @Nullable Integer vCount;
	private @Nullable Integer wCount;
	private @Nullable Double uCellSize;
	private @Nullable Double vCellSize;
	private @Nullable Double wCellSize;
	private @Nullable List<OctreeCell> octreeCells;
	private boolean cellsModified = false;
	private @Nullable List<Point3d> centroids;

	Octree(Workspace workspace, UUID uid, String name, ObjectType entityType) {
		super(workspace, uid, name, entityType);
	}

	public static Octree create(Workspace workspace, String name) {
		return create(workspace, name, null);
	}

	public static Octree create(Workspace workspace, String name, @Nullable Group parent) {
		return workspace.createObject(CLASS, name, parent);
	}

	@Override
	public Optional<Octree> asOctree() {
		return Optional.of(this);
	}

	public Point3d origin() {
		return new Point3d(origin);
	}

	public Octree origin(double x, double y, double z) {
		origin.set(x, y, z);
		geometryChanged();
		return this;
	}

	public Octree origin(@NonNull Tuple3d newOrigin) {
		return origin(newOrigin.x, newOrigin.y, newOrigin.z);
	}

	public Octree origin(@NonNull double[] xyz) {
		if (xyz.length != 3) {
			throw new IllegalArgumentException("Origin must have exactly 3 coordinates; got " + xyz.length);
		}
		return origin(xyz[0], xyz[1], xyz[2]);
	}

	/**
	 * @return rotation angle in degrees about the vertical axis
	 */
	public double rotation() {
		return rotation;
	}

	public Octree rotation(double degrees) {
		if (!Double.isFinite(degrees)) {
			throw new IllegalArgumentException("Rotation must be finite; got " + degrees);
		}
		rotation = degrees;
		geometryChanged();
		return this;
	}

	public @Nullable Integer uCount() { return uCount; }
	public @Nullable Integer vCount() { return vCount; }
	public @Nullable Integer wCount() { return wCount; }

	public Octree uCount(int count) {
		uCount = positiveCount(count, "u_count");
		geometryChanged();
		return this;
	}

	public Octree vCount(int count) {
		vCount = positiveCount(count, "v_count");
		geometryChanged();
		return this;
	}

	public Octree wCount(int count) {
		wCount = positiveCount(count, "w_count");
		geometryChanged();
		return this;
	}

	public @Nullable Double uCellSize() { return uCellSize; }
	public @Nullable Double vCellSize() { return vCellSize; }
	public @Nullable Double wCellSize() { return wCellSize; }

	public Octree uCellSize(double size) {
		uCellSize = positiveSize(size, "u_cell_size");
		geometryChanged();
		return this;
	}

	public Octree vCellSize(double size) {
		vCellSize = positiveSize(size, "v_cell_size");
		geometryChanged();
		return this;
	}

	public Octree wCellSize(double size) {
		wCellSize = positiveSize(size, "w_cell_size");
		geometryChanged();
		return this;
	}

	/**
	 * @return the number of base cells along u, v and w, or empty if any of them is unset
	 */
	public Optional<int[]> shape() {
		if (uCount != null && vCount != null && wCount != null) {
			return Optional.of(new int[] { uCount, vCount, wCount });
		} else {
			return Optional.empty();
		}
	}

	/**
	 * If the cells have not been set, they're fetched from the store
	 * for an octree that was read from one, and computed by
	 * {@link #baseRefine()} otherwise.
	 */
	public List<OctreeCell> octreeCells() {
		if (octreeCells == null) {
			if (existingInStore()) {
				octreeCells = unmodifiableList(new ArrayList<>(workspace().fetchOctreeCells(uid())));
			} else {
				baseRefine();
			}
		}
		return octreeCells;
	}

	public Octree octreeCells(@NonNull List<OctreeCell> cells) {
		octreeCells = unmodifiableList(new ArrayList<>(cells));
		cellsModified = true;
		geometryChanged();
		return this;
	}

	/**
	 * Like {@link #octreeCells()}, except never refines.
	 */
	Optional<List<OctreeCell>> currentCells() {
		if (octreeCells == null && existingInStore()) {
			octreeCells();
		}
		return Optional.ofNullable(octreeCells);
	}

	boolean cellsModified() {
		return cellsModified;
	}

	public int nCells() {
		return octreeCells().size();
	}

	/**
	 * Refines the mesh to its base octree level: cubes as large as the
	 * shortest axis allows, tiling the whole grid.
	 *
	 * <p>
	 * This is a one-time initialization of a mesh that has no cells yet.
	 *
	 * @throws IllegalStateException if the mesh already has cells,
	 * or an axis count is unset or not a power of two
	 */
	public void baseRefine() {
		if (octreeCells != null) {
			throw new IllegalStateException("Base refinement only applies to an octree without cells: " + this);
		}
		int nu = powerOfTwo(uCount, "u_count");
		int nv = powerOfTwo(vCount, "v_count");
		int nw = powerOfTwo(wCount, "w_count");

		// Number of octree levels allowed along each axis
		int levelU = log2(nu);
		int levelV = log2(nv);
		int levelW = log2(nw);
		int minLevel = Math.min(levelU, Math.min(levelV, levelW));

		// The refinement level can't exceed the shortest axis
		int level = Math.min(0, minLevel);

		// Longer axes take extra breaks so every axis steps by the same cube size
		int stepU = 1 << (levelU - (levelU - minLevel) - level);
		int stepV = 1 << (levelV - (levelV - minLevel) - level);
		int stepW = 1 << (levelW - (levelW - minLevel) - level);
		int size = 1 << (minLevel - level);

		List<OctreeCell> cells = new ArrayList<>();
		for (int k = 0; k < nw; k += stepW) {
			for (int j = 0; j < nv; j += stepV) {
				for (int i = 0; i < nu; i += stepU) {
					cells.add(new OctreeCell(i, j, k, size));
				}
			}
		}
		octreeCells = unmodifiableList(cells);
		cellsModified = true;
		centroids = null;
		markModified();
	}

	/**
	 * The world coordinates of each cell's center, in the order of {@link #octreeCells()}.
	 *
	 * <p>
	 * The result is cached: calls in between changes to the mesh
	 * return the same list. Each {@link List#get get} returns a fresh copy
	 * of the point, so modifying it leaves the cache intact.
	 *
	 * @throws IllegalStateException if a cell size is unset,
	 * or there are no cells and they can't be computed
	 */
	public List<Point3d> centroids() {
		if (centroids == null) {
			List<OctreeCell> cells = octreeCells();
			double du = cellSize(uCellSize, "u_cell_size");
			double dv = cellSize(vCellSize, "v_cell_size");
			double dw = cellSize(wCellSize, "w_cell_size");

			Matrix3d rot = new Matrix3d();
			rot.rotZ(Math.toRadians(rotation));

			List<Point3d> result = new ArrayList<>(cells.size());
			for (OctreeCell cell: cells) {
				double half = cell.nCells() / 2.0;
				Point3d centroid = new Point3d(
					(cell.i() + half) * du,
					(cell.j() + half) * dv,
					(cell.k() + half) * dw);
				rot.transform(centroid);
				centroid.add(origin);
				result.add(centroid);
			}
			centroids = new CentroidList(result);
		}
		return centroids;
	}

	private void geometryChanged() {
		centroids = null;
		markModified();
	}

	@Override
	void markSaved() {
		super.markSaved();
		cellsModified = false;
	}

	@Override
	protected AttributeMap attributes() {
		return super.attributes()
			.with(ORIGIN, new double[] { origin.x, origin.y, origin.z })
			.with(ROTATION, rotation)
			.with(NU, uCount)
			.with(NV, vCount)
			.with(NW, wCount)
			.with(U_CELL_SIZE, uCellSize)
			.with(V_CELL_SIZE, vCellSize)
			.with(W_CELL_SIZE, wCellSize);
	}

	@Override
	protected void readAttributes(AttributeMap attributes) {
		super.readAttributes(attributes);
		attributes.doubles(ORIGIN).ifPresent(xyz -> origin.set(xyz));
		rotation = attributes.number(ROTATION).orElse(0.0);
		uCount = attributes.integer(NU).orElse(null);
		vCount = attributes.integer(NV).orElse(null);
		wCount = attributes.integer(NW).orElse(null);
		uCellSize = attributes.number(U_CELL_SIZE).orElse(null);
		vCellSize = attributes.number(V_CELL_SIZE).orElse(null);
		wCellSize = attributes.number(W_CELL_SIZE).orElse(null);
		centroids = null;
	}

	private static int positiveCount(int count, String what) {
		if (count <= 0) {
			throw new IllegalArgumentException(what + " must be positive; got " + count);
		}
		return count;
	}

	private static double positiveSize(double size, String what) {
		if (!(size > 0) || Double.isInfinite(size)) {
			throw new IllegalArgumentException(what + " must be positive; got " + size);
		}
		return size;
	}

	private static int powerOfTwo(@Nullable Integer count, String what) {
		if (count == null) {
			throw new IllegalStateException(what + " must be set");
		} else if (Integer.bitCount(count) != 1) {
			throw new IllegalStateException(what + " must be a power of two; got " + count);
		}
		return count;
	}

	private static double cellSize(@Nullable Double size, String what) {
		if (size == null) {
			throw new IllegalStateException(what + " must be set");
		}
		return size;
	}

	private static int log2(int powerOfTwo) {
		return Integer.numberOfTrailingZeros(powerOfTwo);
	}

	private static final class CentroidList extends AbstractList<Point3d> implements RandomAccess {
		final List<Point3d> points;

		CentroidList(List<Point3d> points) {
			this.points = points;
		}

		@Override
		public Point3d get(int index) {
			return new Point3d(points.get(index));
		}

		@Override
		public int size() {
			return points.size();
		}
	}

	private static final String ORIGIN = "Origin";
	private static final String ROTATION = "Rotation";
	private static final String NU = "NU";
	private static final String NV = "NV";
	private static final String NW = "NW";
	private static final String U_CELL_SIZE = "U Cell Size";
	private static final String V_CELL_SIZE = "V Cell Size";
	private static final String W_CELL_SIZE = "W Cell Size";
}
