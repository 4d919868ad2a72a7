package com.earnix.ccf.file.reader;

import com.earnix.ccf.CcfException;
import org.apache.commons.io.function.IOSupplier;
import org.apache.commons.io.input.BoundedInputStream;

import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Path;

/**
 * Opens bounded input streams over one byte range of a local file, such as the block of a single column
 */
public class FileRangeInputStreamSupplier implements IOSupplier<InputStream>
{
	private final Path file;
	private final long startOffset;
	private final long numBytesToRead;

	public FileRangeInputStreamSupplier(Path file, long startOffset, long numBytesToRead)
	{
		if (startOffset < 0 || numBytesToRead < 0)
			throw new IllegalArgumentException("Invalid range start: " + startOffset + " len: " + numBytesToRead);
		this.file = file;
		this.startOffset = startOffset;
		this.numBytesToRead = numBytesToRead;
	}

	/**
	 * Open the range. The caller MUST close the returned stream, which also closes the underlying channel.
	 *
	 * @return a stream yielding exactly the bytes of the range
	 * @throws CcfException.TruncatedInput if the file ends before the range does
	 * @throws IOException                 on failure to open the file
	 */
	@Override
	public InputStream get() throws IOException
	{
		FileChannel channel = FileChannel.open(file);
		try
		{
			long size = channel.size();
			if (startOffset > size || numBytesToRead > size - startOffset)
				throw new CcfException.TruncatedInput(
						"File " + file + " of " + size + " bytes ends before range start: " + startOffset + " len: "
								+ numBytesToRead);
			channel.position(startOffset);
			return BoundedInputStream.builder()
					.setInputStream(Channels.newInputStream(channel))
					.setMaxCount(numBytesToRead)
					.get();
		}
		catch (IOException | RuntimeException ex)
		{
			channel.close();
			throw ex;
		}
	}
}
