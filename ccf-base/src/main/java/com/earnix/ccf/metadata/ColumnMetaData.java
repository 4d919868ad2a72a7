package com.earnix.ccf.metadata;

import com.earnix.ccf.schema.ColumnDescriptor;
import com.earnix.ccf.schema.DataType;

import java.util.Objects;

/**
 * A column metadata entry of the file header: the column and where its compressed block is stored.
 */
public final class ColumnMetaData
{
	private final ColumnDescriptor descriptor;
	private final long offset;
	private final long compressedSize;
	private final long uncompressedSize;

	/**
	 * @param descriptor       the column
	 * @param offset           absolute offset of the compressed block from the start of the file
	 * @param compressedSize   stored length of the block
	 * @param uncompressedSize length of the block once decompressed
	 */
	public ColumnMetaData(ColumnDescriptor descriptor, long offset, long compressedSize, long uncompressedSize)
	{
		this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
		this.offset = offset;
		this.compressedSize = compressedSize;
		this.uncompressedSize = uncompressedSize;
	}

	public ColumnDescriptor getDescriptor()
	{
		return descriptor;
	}

	public String getName()
	{
		return descriptor.getName();
	}

	public DataType getType()
	{
		return descriptor.getType();
	}

	public long getOffset()
	{
		return offset;
	}

	public long getCompressedSize()
	{
		return compressedSize;
	}

	public long getUncompressedSize()
	{
		return uncompressedSize;
	}

	/**
	 * @return the offset one past the last byte of the block
	 */
	public long getEndOffset()
	{
		return offset + compressedSize;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (!(o instanceof ColumnMetaData))
			return false;
		ColumnMetaData that = (ColumnMetaData) o;
		return offset == that.offset && compressedSize == that.compressedSize
				&& uncompressedSize == that.uncompressedSize && descriptor.equals(that.descriptor);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(descriptor, offset, compressedSize, uncompressedSize);
	}

	@Override
	public String toString()
	{
		return "ColumnMetaData{" + descriptor + ", offset=" + offset + ", compressedSize=" + compressedSize
				+ ", uncompressedSize=" + uncompressedSize + '}';
	}
}
