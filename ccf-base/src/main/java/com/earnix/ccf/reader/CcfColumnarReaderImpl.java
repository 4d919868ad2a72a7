package com.earnix.ccf.reader;

import com.earnix.ccf.CcfException;
import com.earnix.ccf.block.ColumnBlockCodec;
import com.earnix.ccf.compressors.DeflateDecompressor;
import com.earnix.ccf.metadata.CcfFileMetaData;
import com.earnix.ccf.metadata.ColumnMetaData;
import com.earnix.ccf.metadata.FileHeaderCodec;
import com.earnix.ccf.schema.CcfSchema;
import com.earnix.ccf.schema.ColumnDescriptor;
import com.earnix.ccf.table.CcfTable;
import com.earnix.ccf.table.ColumnValues;
import org.apache.commons.io.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A {@link CcfColumnarReader} agnostic to the backing storage
 */
public class CcfColumnarReaderImpl implements CcfColumnarReader
{
	private static final Logger LOG = LoggerFactory.getLogger(CcfColumnarReaderImpl.class);

	private final CcfReaderInputStreamSupplier inputStreamSupplier;
	private final CcfFileMetaData fileMetaData;
	private final ColumnBlockCodec blockCodec;

	/**
	 * Open a CCF file by parsing its header
	 *
	 * @param inputStreamSupplier supplier to get arbitrary InputStreams for CCF files agnostic to backing storage
	 *                            (filesystem, memory, etc.)
	 * @throws IOException on an IO failure reading the header, or a {@link CcfException} if the header is invalid
	 */
	public CcfColumnarReaderImpl(CcfReaderInputStreamSupplier inputStreamSupplier) throws IOException
	{
		this.inputStreamSupplier = inputStreamSupplier;
		// blocks are only decompressed here, the compressor is never used
		this.blockCodec = new ColumnBlockCodec(null, new DeflateDecompressor());

		long totalLength = inputStreamSupplier.getTotalLength();
		FileHeaderCodec.Preamble preamble;
		// a shorter source is reported as truncated by the preamble parser
		try (InputStream is = inputStreamSupplier.createInputStream(0,
				Math.min(FileHeaderCodec.PREAMBLE_SIZE, totalLength)))
		{
			preamble = FileHeaderCodec.decodePreamble(is, totalLength);
		}
		try (InputStream is = inputStreamSupplier.createInputStream(FileHeaderCodec.PREAMBLE_SIZE,
				preamble.getHeaderSize()))
		{
			this.fileMetaData = FileHeaderCodec.decodeEntries(is, preamble);
		}
		validateColumnRanges(totalLength);
		LOG.debug("Opened CCF file with {} rows and {} columns", fileMetaData.getNumRows(),
				fileMetaData.getColumns().size());
	}

	private void validateColumnRanges(long totalLength) throws CcfException.TruncatedInput
	{
		for (ColumnMetaData column : fileMetaData.getColumns())
		{
			long offset = column.getOffset();
			long compressedSize = column.getCompressedSize();
			if (offset < 0 || compressedSize < 0 || offset > totalLength || compressedSize > totalLength - offset)
				throw new CcfException.TruncatedInput(
						"Block of column " + column.getName() + " at offset " + Long.toUnsignedString(offset)
								+ " with " + Long.toUnsignedString(compressedSize) + " bytes exceeds the "
								+ totalLength + " bytes of input");
		}
	}

	@Override
	public CcfFileMetaData getFileMetaData()
	{
		return fileMetaData;
	}

	@Override
	public CcfSchema getSchema()
	{
		return fileMetaData.getSchema();
	}

	@Override
	public long getNumRows()
	{
		return fileMetaData.getNumRows();
	}

	@Override
	public List<ColumnDescriptor> getColumnDescriptors()
	{
		return getSchema().getColumns();
	}

	@Override
	public List<ColumnMetaData> getColumnMetaData()
	{
		return fileMetaData.getColumns();
	}

	@Override
	public ColumnValues readColumn(String columnName) throws IOException
	{
		return readBlock(findColumn(columnName));
	}

	@Override
	public CcfTable readColumns(Collection<String> columnNames) throws IOException
	{
		List<ColumnMetaData> toRead;
		if (columnNames == null)
		{
			toRead = fileMetaData.getColumns();
		}
		else
		{
			// resolve every name before touching any block
			toRead = new ArrayList<>(columnNames.size());
			for (String name : new LinkedHashSet<>(columnNames))
			{
				toRead.add(findColumn(name));
			}
		}
		LOG.debug("Reading columns {}", toRead.stream().map(ColumnMetaData::getName).collect(Collectors.toList()));

		List<ColumnValues> columns = new ArrayList<>(toRead.size());
		for (ColumnMetaData column : toRead)
		{
			columns.add(readBlock(column));
		}
		return new CcfTable(fileMetaData.getNumRows(), columns);
	}

	private ColumnMetaData findColumn(String name) throws CcfException.UnknownColumn
	{
		return fileMetaData.findColumn(name).orElseThrow(() -> new CcfException.UnknownColumn(name));
	}

	private ColumnValues readBlock(ColumnMetaData column) throws IOException
	{
		if (column.getCompressedSize() > Integer.MAX_VALUE)
			throw new CcfException.CorruptBlock(
					"Block of column " + column.getName() + " is too large: " + column.getCompressedSize());
		byte[] compressed = new byte[(int) column.getCompressedSize()];
		try (InputStream is = inputStreamSupplier.createInputStream(column.getOffset(), column.getCompressedSize()))
		{
			IOUtils.readFully(is, compressed);
		}
		catch (EOFException ex)
		{
			throw new CcfException.TruncatedInput("Block of column " + column.getName() + " is truncated");
		}
		return blockCodec.decode(column.getDescriptor(), compressed, (int) fileMetaData.getNumRows(),
				column.getUncompressedSize());
	}
}
