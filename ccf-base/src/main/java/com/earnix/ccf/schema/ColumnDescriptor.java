package com.earnix.ccf.schema;

import com.earnix.ccf.utils.LittleEndianWriter;

import java.util.Objects;

/**
 * Name and declared type of one column. The on-disk location of the column is carried separately by
 * {@link com.earnix.ccf.metadata.ColumnMetaData}.
 */
public final class ColumnDescriptor
{
	private final String name;
	private final DataType type;

	public ColumnDescriptor(String name, DataType type)
	{
		this.name = Objects.requireNonNull(name, "name");
		this.type = Objects.requireNonNull(type, "type");
		if (name.isEmpty())
			throw new IllegalArgumentException("Column name must not be empty");
		// fails on names that cannot be stored, such as ones holding an unpaired surrogate
		LittleEndianWriter.encodeUtf8(name);
	}

	public String getName()
	{
		return name;
	}

	public DataType getType()
	{
		return type;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (!(o instanceof ColumnDescriptor))
			return false;
		ColumnDescriptor that = (ColumnDescriptor) o;
		return name.equals(that.name) && type == that.type;
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(name, type);
	}

	@Override
	public String toString()
	{
		return name + ":" + type;
	}
}
