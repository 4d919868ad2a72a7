package com.earnix.ccf.writer;

import com.earnix.ccf.block.ColumnBlock;
import com.earnix.ccf.schema.CcfSchema;
import com.earnix.ccf.table.CcfTable;
import com.earnix.ccf.table.ColumnValues;
import com.earnix.ccf.writer.columnblock.ColumnValuesWritingFunction;

import java.io.Closeable;
import java.io.IOException;

public interface CcfColumnarWriter extends Closeable
{
	/**
	 * @return the schema this writer was created for
	 */
	CcfSchema getSchema();

	/**
	 * @return the number of rows every column must contain
	 */
	long getNumRows();

	/**
	 * Encode and append the next column. Columns must be written in schema order.
	 *
	 * @param writingFunction callback that encodes the column through the supplied block writer
	 * @throws IOException on failure encoding the column
	 */
	void writeValues(ColumnValuesWritingFunction writingFunction) throws IOException;

	/**
	 * Append an already encoded column block. Columns must be written in schema order.
	 *
	 * @param columnBlock the encoded block
	 */
	void writeValues(ColumnBlock columnBlock);

	/**
	 * Write every column of the table. The table must match the schema and row count of this writer.
	 *
	 * @param table the table to write
	 * @throws IOException on failure encoding a column
	 */
	default void writeTable(CcfTable table) throws IOException
	{
		if (!table.getSchema().equals(getSchema()))
			throw new IllegalArgumentException("Table schema " + table.getSchema() + " does not match " + getSchema());
		for (ColumnValues column : table.getColumns())
		{
			writeValues(columnBlockWriter -> columnBlockWriter.writeColumn(column));
		}
	}

	/**
	 * Write the header followed by all column blocks. Note that {@link #close()} should still be called after.
	 *
	 * @return information about the written file
	 * @throws IOException on failure writing to the destination
	 */
	CcfFileInfo finishAndWriteFile() throws IOException;
}
