package io.vena.geoh5;

import io.vena.geoh5.store.AttributeMap;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import javax.vecmath.Point3d;
import javax.vecmath.Tuple3d;
import lombok.NonNull;
import org.jetbrains.annotations.Nullable;

/**
 * A cloud of vertices.
 */
public class Points extends ObjectBase {
	public static final TypeIdentity TYPE_IDENTITY = TypeIdentity.of(
		UUID.fromString("202c5db1-a56d-4004-9cad-baafd8899406"),
		"Points",
		"Points");

	public static final EntityClass<ObjectType, Points> CLASS = new EntityClass<>(Points.class, TYPE_IDENTITY, Points::new);

	private final List<Point3d> vertices = new ArrayList<>();

	protected Points(Workspace workspace, UUID uid, String name, ObjectType entityType) {
		super(workspace, uid, name, entityType);
	}

	public static Points create(Workspace workspace, String name, @Nullable Group parent) {
		return workspace.createObject(CLASS, name, parent);
	}

	public List<Point3d> vertices() {
		List<Point3d> result = new ArrayList<>(vertices.size());
		vertices.forEach(v -> result.add(new Point3d(v)));
		return result;
	}

	public void vertices(@NonNull List<? extends Tuple3d> newVertices) {
		vertices.clear();
		newVertices.forEach(v -> vertices.add(new Point3d(v)));
		markModified();
	}

	/**
	 * @param xyz one row of three coordinates per vertex
	 */
	public void vertices(@NonNull double[][] xyz) {
		List<Point3d> newVertices = new ArrayList<>(xyz.length);
		for (double[] row: xyz) {
			if (row.length != 3) {
				throw new IllegalArgumentException("Vertices must have exactly 3 coordinates; got " + row.length);
			}
			newVertices.add(new Point3d(row));
		}
		vertices(newVertices);
	}

	public int nVertices() {
		return vertices.size();
	}

	@Override
	protected AttributeMap attributes() {
		double[] flat = new double[3 * vertices.size()];
		for (int i = 0; i < vertices.size(); i++) {
			Point3d v = vertices.get(i);
			flat[3*i] = v.x;
			flat[3*i + 1] = v.y;
			flat[3*i + 2] = v.z;
		}
		return super.attributes().with(VERTICES, flat);
	}

	@Override
	protected void readAttributes(AttributeMap attributes) {
		super.readAttributes(attributes);
		vertices.clear();
		attributes.doubles(VERTICES).ifPresent(flat -> {
			if (flat.length % 3 != 0) {
				throw new IllegalArgumentException("Vertex coordinates must come in threes; got " + flat.length);
			}
			for (int i = 0; i < flat.length; i += 3) {
				vertices.add(new Point3d(flat[i], flat[i+1], flat[i+2]));
			}
		});
	}

	private static final String VERTICES = "Vertices";
}
