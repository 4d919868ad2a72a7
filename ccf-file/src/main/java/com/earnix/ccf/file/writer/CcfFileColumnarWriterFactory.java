package com.earnix.ccf.file.writer;

import com.earnix.ccf.config.CcfWriteConfig;
import com.earnix.ccf.schema.CcfSchema;
import com.earnix.ccf.writer.CcfColumnarWriter;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A factory to create CCF file writers
 */
public class CcfFileColumnarWriterFactory
{
	/**
	 * Create a CCF file writer. Any existing file is truncated.
	 *
	 * @param outputFile      the file to write the CCF data to
	 * @param schema          the columns of the file
	 * @param numRows         the number of rows of every column
	 * @param config          the write config
	 * @param cacheFileHandle whether to hold the file open until the writer is closed
	 * @return the CCF file writer. Note that this MUST be closed externally.
	 * @throws IOException on failure to open the file
	 */
	public static CcfColumnarWriter createWriter(Path outputFile, CcfSchema schema, long numRows,
			CcfWriteConfig config, boolean cacheFileHandle) throws IOException
	{
		return new CcfFileColumnarWriterImpl(outputFile, schema, numRows, config, cacheFileHandle);
	}

	/**
	 * Create a CCF file writer with the default config
	 *
	 * @param outputFile the file to write the CCF data to
	 * @param schema     the columns of the file
	 * @param numRows    the number of rows of every column
	 * @return the CCF file writer. Note that this MUST be closed externally.
	 * @throws IOException on failure to open the file
	 */
	public static CcfColumnarWriter createWriter(Path outputFile, CcfSchema schema, long numRows) throws IOException
	{
		return createWriter(outputFile, schema, numRows, new CcfWriteConfig(), false);
	}

	private CcfFileColumnarWriterFactory()
	{
		// static methods ONLY
	}
}
