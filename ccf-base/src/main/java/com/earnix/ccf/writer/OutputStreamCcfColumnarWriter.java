package com.earnix.ccf.writer;

import com.earnix.ccf.config.CcfWriteConfig;
import com.earnix.ccf.schema.CcfSchema;
import org.apache.commons.io.function.IOConsumer;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Writes a CCF file to an arbitrary {@link OutputStream}. The stream is owned by the writer and closed by
 * {@link #close()}.
 */
public class OutputStreamCcfColumnarWriter extends BaseCcfColumnarWriter
{
	private final OutputStream outputStream;

	public OutputStreamCcfColumnarWriter(OutputStream outputStream, CcfSchema schema, long numRows)
	{
		this(outputStream, schema, numRows, new CcfWriteConfig());
	}

	public OutputStreamCcfColumnarWriter(OutputStream outputStream, CcfSchema schema, long numRows,
			CcfWriteConfig config)
	{
		super(schema, numRows, config);
		this.outputStream = outputStream;
	}

	@Override
	protected void writeToOutput(IOConsumer<OutputStream> operation) throws IOException
	{
		operation.accept(outputStream);
	}

	@Override
	public void close() throws IOException
	{
		outputStream.close();
	}
}
