package com.earnix.ccf.file.writer;

import com.earnix.ccf.config.CcfWriteConfig;
import com.earnix.ccf.schema.CcfSchema;
import com.earnix.ccf.writer.BaseCcfColumnarWriter;
import org.apache.commons.io.function.IOConsumer;
import org.apache.commons.io.output.CloseShieldOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

public class CcfFileColumnarWriterImpl extends BaseCcfColumnarWriter
{
	private static final Logger LOG = LoggerFactory.getLogger(CcfFileColumnarWriterImpl.class);

	private final Path outputFile;
	private final FileChannel fileChannel;

	CcfFileColumnarWriterImpl(Path outputFile, CcfSchema schema, long numRows, CcfWriteConfig config,
			boolean cacheFileChannel) throws IOException
	{
		super(schema, numRows, config);
		this.outputFile = outputFile;
		fileChannel = cacheFileChannel ? openChannel() : null;

		// if we don't cache the file channel, open it and close it to check permissions and truncate any existing data
		if (fileChannel == null)
		{
			openChannel().close();
		}
	}

	private FileChannel openChannel() throws IOException
	{
		return FileChannel.open(outputFile, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE,
				StandardOpenOption.CREATE);
	}

	@Override
	protected void writeToOutput(IOConsumer<OutputStream> operation) throws IOException
	{
		if (fileChannel == null)
		{
			try (FileChannel fc = openChannel())
			{
				writeToChannel(fc, operation);
			}
		}
		else
		{
			writeToChannel(fileChannel, operation);
		}
		LOG.debug("Wrote CCF file {}", outputFile);
	}

	private static void writeToChannel(FileChannel fc, IOConsumer<OutputStream> operation) throws IOException
	{
		// the channel is closed by its owner, not by the stream
		OutputStream os = new BufferedOutputStream(CloseShieldOutputStream.wrap(Channels.newOutputStream(fc)));
		operation.accept(os);
		os.flush();
	}

	@Override
	public void close() throws IOException
	{
		if (fileChannel != null)
			fileChannel.close();
	}
}
