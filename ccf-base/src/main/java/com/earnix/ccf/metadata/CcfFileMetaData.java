package com.earnix.ccf.metadata;

import com.earnix.ccf.schema.CcfSchema;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Everything the file header holds: version, row count and one {@link ColumnMetaData} per column in schema order.
 */
public final class CcfFileMetaData
{
	private final int version;
	private final long numRows;
	private final long headerSize;
	private final List<ColumnMetaData> columns;
	private final CcfSchema schema;

	/**
	 * @param version    the format version
	 * @param numRows    the row count shared by all columns
	 * @param headerSize the length of the metadata entries region, excluding the fixed preamble
	 * @param columns    the column entries in schema order
	 */
	public CcfFileMetaData(int version, long numRows, long headerSize, List<ColumnMetaData> columns)
	{
		this.version = version;
		this.numRows = numRows;
		this.headerSize = headerSize;
		this.columns = List.copyOf(columns);
		this.schema = new CcfSchema(
				this.columns.stream().map(ColumnMetaData::getDescriptor).collect(Collectors.toList()));
	}

	public int getVersion()
	{
		return version;
	}

	public long getNumRows()
	{
		return numRows;
	}

	public long getHeaderSize()
	{
		return headerSize;
	}

	/**
	 * @return the offset of the first column block, right after the header
	 */
	public long getDataStartOffset()
	{
		return FileHeaderCodec.PREAMBLE_SIZE + headerSize;
	}

	public List<ColumnMetaData> getColumns()
	{
		return columns;
	}

	public CcfSchema getSchema()
	{
		return schema;
	}

	public Optional<ColumnMetaData> findColumn(String name)
	{
		return schema.indexOf(name).map(columns::get);
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (!(o instanceof CcfFileMetaData))
			return false;
		CcfFileMetaData that = (CcfFileMetaData) o;
		return version == that.version && numRows == that.numRows && headerSize == that.headerSize
				&& columns.equals(that.columns);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(version, numRows, headerSize, columns);
	}

	@Override
	public String toString()
	{
		return "CcfFileMetaData{version=" + version + ", numRows=" + numRows + ", headerSize=" + headerSize
				+ ", columns=" + columns + '}';
	}
}
