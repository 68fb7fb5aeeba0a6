package io.vena.geoh5;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum PrimitiveType {
	UNKNOWN("Unknown"),
	INTEGER("Integer"),
	FLOAT("Float"),
	TEXT("Text"),
	REFERENCED("Referenced"),
	FILENAME("Filename"),
	BLOB("Blob"),
	VECTOR("Vector"),
	DATETIME("DateTime"),
	GEOMETRIC("Geometric"),
	MULTI_TEXT("Multi-Text"),
	BOOLEAN("Boolean"),
	;

	private final String displayName;
}
