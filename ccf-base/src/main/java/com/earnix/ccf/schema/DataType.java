package com.earnix.ccf.schema;

import com.earnix.ccf.CcfException;

/**
 * The physical column types a CCF file can store, with their on-disk type codes.
 */
public enum DataType
{
	INT32(0, Integer.BYTES),
	FLOAT64(1, Double.BYTES),
	UTF8_STRING(2, -1);

	private final int code;
	private final int fixedWidth;

	DataType(int code, int fixedWidth)
	{
		this.code = code;
		this.fixedWidth = fixedWidth;
	}

	/**
	 * @return the DTYPE byte written to the column metadata
	 */
	public int getCode()
	{
		return code;
	}

	/**
	 * @return whether each row occupies a fixed-width payload slot
	 */
	public boolean isFixedWidth()
	{
		return fixedWidth > 0;
	}

	/**
	 * @return the width in bytes of one payload slot. Only valid for fixed width types.
	 */
	public int getFixedWidth()
	{
		if (!isFixedWidth())
			throw new IllegalStateException(this + " is not a fixed width type");
		return fixedWidth;
	}

	/**
	 * Resolve a DTYPE byte
	 *
	 * @param code the type code read from the file
	 * @return the matching type
	 * @throws CcfException.SchemaMismatch if the code is not a known type
	 */
	public static DataType fromCode(int code) throws CcfException.SchemaMismatch
	{
		switch (code)
		{
		case 0:
			return INT32;
		case 1:
			return FLOAT64;
		case 2:
			return UTF8_STRING;
		default:
			throw new CcfException.SchemaMismatch("Invalid column type code: " + code);
		}
	}
}
