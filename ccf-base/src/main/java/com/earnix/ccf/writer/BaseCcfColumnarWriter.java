package com.earnix.ccf.writer;

import com.earnix.ccf.block.ColumnBlock;
import com.earnix.ccf.config.CcfWriteConfig;
import com.earnix.ccf.metadata.CcfFileMetaData;
import com.earnix.ccf.metadata.ColumnMetaData;
import com.earnix.ccf.metadata.FileHeaderCodec;
import com.earnix.ccf.schema.CcfSchema;
import com.earnix.ccf.schema.ColumnDescriptor;
import com.earnix.ccf.writer.columnblock.ColumnBlockWriter;
import com.earnix.ccf.writer.columnblock.ColumnBlockWriterImpl;
import com.earnix.ccf.writer.columnblock.ColumnValuesWritingFunction;
import org.apache.commons.io.function.IOConsumer;
import org.apache.commons.io.output.CountingOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * an abstract class holding the column blocks of a file until the header can be written. Subclasses supply the
 * destination.
 */
public abstract class BaseCcfColumnarWriter implements CcfColumnarWriter
{
	private static final Logger LOG = LoggerFactory.getLogger(BaseCcfColumnarWriter.class);

	private final CcfSchema schema;
	private final long numRows;
	private final ColumnBlockWriter columnBlockWriter;
	private final List<ColumnBlock> columnBlocks = new ArrayList<>();
	private boolean finished = false;

	protected BaseCcfColumnarWriter(CcfSchema schema, long numRows, CcfWriteConfig config)
	{
		this.schema = Objects.requireNonNull(schema, "schema must not be null");
		if (numRows < 0)
			throw new IllegalArgumentException("Negative row count: " + numRows);
		this.numRows = numRows;
		this.columnBlockWriter = new ColumnBlockWriterImpl(config.createBlockCodec());
	}

	@Override
	public CcfSchema getSchema()
	{
		return schema;
	}

	@Override
	public long getNumRows()
	{
		return numRows;
	}

	@Override
	public void writeValues(ColumnValuesWritingFunction writingFunction) throws IOException
	{
		assertNotFinished();
		writeValues(writingFunction.apply(columnBlockWriter));
	}

	@Override
	public void writeValues(ColumnBlock columnBlock)
	{
		assertNotFinished();
		if (columnBlocks.size() >= schema.getNumColumns())
			throw new IllegalStateException(
					"All " + schema.getNumColumns() + " columns were already written, got " + columnBlock.getDescriptor());

		ColumnDescriptor expected = schema.getColumn(columnBlocks.size());
		if (!expected.equals(columnBlock.getDescriptor()))
			throw new IllegalStateException(
					"Expected column " + expected + " at index " + columnBlocks.size() + " but got "
							+ columnBlock.getDescriptor());
		if (columnBlock.getNumRows() != numRows)
			throw new IllegalStateException(
					"Column " + expected.getName() + " has " + columnBlock.getNumRows() + " rows, expected "
							+ numRows);
		columnBlocks.add(columnBlock);
	}

	@Override
	public CcfFileInfo finishAndWriteFile() throws IOException
	{
		assertNotFinished();
		if (columnBlocks.size() != schema.getNumColumns())
			throw new IllegalStateException(
					"Only " + columnBlocks.size() + " of " + schema.getNumColumns() + " columns were written");
		finished = true;

		long headerSize = FileHeaderCodec.metadataEntriesSize(schema.getColumns());
		long cursor = FileHeaderCodec.PREAMBLE_SIZE + headerSize;
		List<ColumnMetaData> columns = new ArrayList<>(columnBlocks.size());
		for (ColumnBlock block : columnBlocks)
		{
			ColumnMetaData column = new ColumnMetaData(block.getDescriptor(), cursor, block.getCompressedSize(),
					block.getUncompressedSize());
			LOG.debug("Column {} at offset {} compressed {} uncompressed {}", column.getName(), cursor,
					column.getCompressedSize(), column.getUncompressedSize());
			columns.add(column);
			cursor += block.getCompressedSize();
		}

		byte[] header = FileHeaderCodec.encode(numRows, columns);
		long expectedSize = cursor;
		writeToOutput(os -> {
			CountingOutputStream counting = new CountingOutputStream(os);
			counting.write(header);
			for (ColumnBlock block : columnBlocks)
			{
				block.writeToOutputStream(counting);
			}
			counting.flush();
			if (counting.getByteCount() != expectedSize)
				throw new IllegalStateException(
						"Wrote " + counting.getByteCount() + " bytes but the layout requires " + expectedSize);
		});

		CcfFileMetaData fileMetaData = new CcfFileMetaData(FileHeaderCodec.CURRENT_VERSION, numRows, headerSize,
				columns);
		LOG.debug("Finished CCF file with {} rows, {} columns, {} bytes", numRows, columns.size(), expectedSize);
		return new CcfFileInfo(expectedSize, fileMetaData);
	}

	/**
	 * Write the complete file contents to the destination. Called exactly once.
	 *
	 * @param operation the operation writing the header and the blocks
	 * @throws IOException on failure writing to the destination
	 */
	protected abstract void writeToOutput(IOConsumer<OutputStream> operation) throws IOException;

	private void assertNotFinished()
	{
		if (finished)
			throw new IllegalStateException("File was already finished");
	}
}
