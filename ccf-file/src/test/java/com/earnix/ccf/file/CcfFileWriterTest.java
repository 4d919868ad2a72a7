package com.earnix.ccf.file;

import com.earnix.ccf.config.CcfWriteConfig;
import com.earnix.ccf.file.reader.CcfFileReaderFactory;
import com.earnix.ccf.file.reader.FileRangeInputStreamSupplier;
import com.earnix.ccf.file.writer.CcfFileColumnarWriterFactory;
import com.earnix.ccf.metadata.ColumnMetaData;
import com.earnix.ccf.metadata.FileHeaderCodec;
import com.earnix.ccf.reader.CcfColumnarReader;
import com.earnix.ccf.reader.CcfColumnarReaderImpl;
import com.earnix.ccf.reader.CcfReaderInputStreamSupplier;
import com.earnix.ccf.schema.CcfSchema;
import com.earnix.ccf.schema.ColumnDescriptor;
import com.earnix.ccf.schema.DataType;
import com.earnix.ccf.table.CcfTable;
import com.earnix.ccf.table.DoubleColumnValues;
import com.earnix.ccf.table.IntColumnValues;
import com.earnix.ccf.table.StringColumnValues;
import com.earnix.ccf.writer.CcfColumnarWriter;
import com.earnix.ccf.writer.CcfFileInfo;
import org.apache.commons.io.FileUtils;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Tests writing CCF files and reading them back from disk
 */
public class CcfFileWriterTest
{
	private static final ColumnDescriptor ID = new ColumnDescriptor("id", DataType.INT32);
	private static final ColumnDescriptor SCORE = new ColumnDescriptor("score", DataType.FLOAT64);
	private static final ColumnDescriptor NAME = new ColumnDescriptor("name", DataType.UTF8_STRING);
	private static final CcfSchema SCHEMA = CcfSchema.of(ID, SCORE, NAME);

	private Path tmpFolder;

	@Before
	public void setUp() throws Exception
	{
		tmpFolder = Files.createTempDirectory("ccf_file_test");
	}

	@After
	public void tearDown() throws Exception
	{
		FileUtils.forceDelete(tmpFolder.toFile());
	}

	private static CcfFileInfo writeSample(Path file, boolean cacheFileHandle) throws IOException
	{
		try (CcfColumnarWriter writer = CcfFileColumnarWriterFactory.createWriter(file, SCHEMA, 3,
				new CcfWriteConfig(CcfWriteConfig.DEFAULT_COMPRESSION_LEVEL), cacheFileHandle))
		{
			writer.writeValues(w -> w.writeColumn(ID, new int[] { 1, 2, 3 }));
			writer.writeValues(w -> w.writeColumn(SCORE, new Double[] { 9.5, null, 7.25 }));
			writer.writeValues(w -> w.writeColumn(NAME, new String[] { "alice", "bob", null }));
			return writer.finishAndWriteFile();
		}
	}

	@Test
	public void writeAndReadBack() throws Exception
	{
		for (boolean cacheFileHandle : new boolean[] { true, false })
		{
			Path file = tmpFolder.resolve("sample_" + cacheFileHandle + ".ccf");
			CcfFileInfo info = writeSample(file, cacheFileHandle);
			Assert.assertEquals(Files.size(file), info.getTotalFileSize());

			CcfColumnarReader reader = CcfFileReaderFactory.createColumnarFileReader(file);
			Assert.assertEquals(info.getFileMetaData(), reader.getFileMetaData());
			Assert.assertEquals(3, reader.getNumRows());
			Assert.assertEquals(SCHEMA, reader.getSchema());

			CcfTable expected = CcfTable.of(IntColumnValues.of("id", 1, 2, 3),
					DoubleColumnValues.of("score", 9.5, null, 7.25), StringColumnValues.of("name", "alice", "bob", null));
			Assert.assertEquals(expected, reader.readTable());
		}
	}

	@Test
	public void offsetsFollowHeader() throws Exception
	{
		Path file = tmpFolder.resolve("offsets.ccf");
		CcfFileInfo info = writeSample(file, true);
		List<ColumnMetaData> columns = info.getFileMetaData().getColumns();

		long cursor = FileHeaderCodec.PREAMBLE_SIZE + info.getFileMetaData().getHeaderSize();
		for (ColumnMetaData column : columns)
		{
			Assert.assertEquals(cursor, column.getOffset());
			cursor += column.getCompressedSize();
		}
		Assert.assertEquals(Files.size(file), cursor);
	}

	/**
	 * Reading only "name" opens only the header range and the name block
	 */
	@Test
	public void readOnlyNameColumn() throws Exception
	{
		Path file = tmpFolder.resolve("select.ccf");
		writeSample(file, false);

		List<long[]> ranges = new ArrayList<>();
		CcfColumnarReader reader = new CcfColumnarReaderImpl(new CcfReaderInputStreamSupplier()
		{
			@Override
			public long getTotalLength() throws IOException
			{
				return Files.size(file);
			}

			@Override
			public InputStream createInputStream(long startOffset, long numBytesToRead) throws IOException
			{
				ranges.add(new long[] { startOffset, numBytesToRead });
				return new FileRangeInputStreamSupplier(file, startOffset, numBytesToRead).get();
			}
		});
		// preamble, then metadata entries; no block is touched on open
		long headerEnd = FileHeaderCodec.PREAMBLE_SIZE + reader.getFileMetaData().getHeaderSize();
		Assert.assertEquals(2, ranges.size());
		Assert.assertArrayEquals(new long[] { 0, FileHeaderCodec.PREAMBLE_SIZE }, ranges.get(0));
		Assert.assertEquals(FileHeaderCodec.PREAMBLE_SIZE, ranges.get(1)[0]);
		for (long[] range : ranges)
		{
			Assert.assertTrue(range[0] + range[1] <= headerEnd);
		}
		Assert.assertTrue(headerEnd < Files.size(file));
		ranges.clear();

		CcfTable table = reader.readColumns(List.of("name"));
		Assert.assertEquals(List.of("name"), table.getColumnNames());
		Assert.assertEquals(Arrays.asList("alice", "bob", null), table.getColumn("name").toList());

		ColumnMetaData name = reader.getFileMetaData().findColumn("name").get();
		Assert.assertEquals(1, ranges.size());
		Assert.assertArrayEquals(new long[] { name.getOffset(), name.getCompressedSize() }, ranges.get(0));
	}

	@Test
	public void existingFileIsTruncated() throws Exception
	{
		Path file = tmpFolder.resolve("existing.ccf");
		Files.write(file, new byte[10_000]);
		CcfFileInfo info = writeSample(file, false);
		Assert.assertEquals(info.getTotalFileSize(), Files.size(file));
		Assert.assertEquals(3, CcfFileReaderFactory.createColumnarFileReader(file).getNumRows());
	}

	@Test
	public void largeColumns() throws Exception
	{
		int numRows = 50_000;
		int[] ids = new int[numRows];
		Double[] scores = new Double[numRows];
		String[] names = new String[numRows];
		for (int i = 0; i < numRows; i++)
		{
			ids[i] = i;
			scores[i] = i % 5 == 0 ? null : i / 3.0;
			names[i] = i % 7 == 0 ? null : (i % 11 == 0 ? "" : "name-" + i);
		}

		Path file = tmpFolder.resolve("large.ccf");
		try (CcfColumnarWriter writer = CcfFileColumnarWriterFactory.createWriter(file, SCHEMA, numRows))
		{
			writer.writeValues(w -> w.writeColumn(ID, ids));
			writer.writeValues(w -> w.writeColumn(SCORE, scores));
			writer.writeValues(w -> w.writeColumn(NAME, names));
			writer.finishAndWriteFile();
		}

		CcfColumnarReader reader = CcfFileReaderFactory.createColumnarFileReader(file);
		Assert.assertEquals(Arrays.asList(scores), reader.readColumn("score").toList());
		Assert.assertEquals(Arrays.asList(names), reader.readColumn("name").toList());
		Assert.assertEquals(new IntColumnValues(ID, ids), reader.readColumn("id"));
	}
}
