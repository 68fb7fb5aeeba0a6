package io.vena.geoh5;

import lombok.Getter;
import lombok.NonNull;

/**
 * An {@link EntityClass} for {@link Data}, which also fixes the
 * {@link PrimitiveType} of the values its instances hold.
 */
@Getter
public class DataClass<D extends Data> extends EntityClass<DataType, D> {
	@NonNull private final PrimitiveType primitiveType;

	public DataClass(Class<D> javaClass, PrimitiveType primitiveType, EntityConstructor<DataType, D> constructor) {
		super(javaClass, TypeIdentity.unregistered(primitiveType.displayName()), constructor);
		this.primitiveType = primitiveType;
	}
}
