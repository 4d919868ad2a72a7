package com.earnix.ccf.reader;

import com.earnix.ccf.metadata.CcfFileMetaData;
import com.earnix.ccf.metadata.ColumnMetaData;
import com.earnix.ccf.schema.CcfSchema;
import com.earnix.ccf.schema.ColumnDescriptor;
import com.earnix.ccf.table.CcfTable;
import com.earnix.ccf.table.ColumnValues;

import java.io.IOException;
import java.util.Collection;
import java.util.List;

/**
 * A reader over an opened CCF file. Only the header is parsed on open, column blocks are read on demand.
 */
public interface CcfColumnarReader
{
	CcfFileMetaData getFileMetaData();

	CcfSchema getSchema();

	long getNumRows();

	/**
	 * @return the columns in schema order
	 */
	List<ColumnDescriptor> getColumnDescriptors();

	/**
	 * @return the metadata entries in schema order
	 */
	List<ColumnMetaData> getColumnMetaData();

	/**
	 * Read and decode a single column
	 *
	 * @param columnName the column name
	 * @return the decoded values
	 * @throws IOException on failure reading or decoding the column block
	 */
	ColumnValues readColumn(String columnName) throws IOException;

	/**
	 * Read a subset of the columns. The returned table lists the columns in the order requested; duplicate names are
	 * read once.
	 *
	 * @param columnNames the columns to read, or null to read all columns in schema order
	 * @return a table with the requested columns
	 * @throws IOException on failure reading or decoding a column block, or if a name is unknown
	 */
	CcfTable readColumns(Collection<String> columnNames) throws IOException;

	/**
	 * @return all columns in schema order
	 * @throws IOException on failure reading or decoding a column block
	 */
	default CcfTable readTable() throws IOException
	{
		return readColumns(null);
	}
}
