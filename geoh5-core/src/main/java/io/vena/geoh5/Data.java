package io.vena.geoh5;

import io.vena.geoh5.store.AttributeMap;
import java.util.UUID;
import lombok.NonNull;

/**
 * A channel of values attached to an {@link ObjectBase object}.
 * Data always has an object as its parent, and never has children.
 */
public abstract class Data extends Entity<DataType> {
	private DataAssociation association = DataAssociation.OBJECT;

	protected Data(Workspace workspace, UUID uid, String name, DataType entityType) {
		super(workspace, uid, name, entityType);
	}

	@Override
	public final EntityKind kind() {
		return EntityKind.DATA;
	}

	public abstract PrimitiveType primitiveType();

	public DataAssociation association() {
		return association;
	}

	public void association(@NonNull DataAssociation newAssociation) {
		association = newAssociation;
		markModified();
	}

	@Override
	protected AttributeMap attributes() {
		return super.attributes().with(ASSOCIATION, association);
	}

	@Override
	protected void readAttributes(AttributeMap attributes) {
		super.readAttributes(attributes);
		association = attributes.string(ASSOCIATION)
			.map(DataAssociation::valueOf)
			.orElse(DataAssociation.OBJECT);
	}

	protected static final String VALUES = "Values";
	private static final String ASSOCIATION = "Association";
}
