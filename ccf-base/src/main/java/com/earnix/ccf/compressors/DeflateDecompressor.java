package com.earnix.ccf.compressors;

import com.earnix.ccf.CcfException;
import org.apache.commons.io.output.UnsynchronizedByteArrayOutputStream;

import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

/**
 * Inflates a zlib stream into a buffer that grows with the actual output. The declared size only caps the output, it is
 * never used to allocate up front.
 */
public class DeflateDecompressor implements Decompressor
{
	private static final int CHUNK_SIZE = 8192;

	@Override
	public byte[] decompress(byte[] input, int uncompressedSize) throws CcfException.CorruptBlock
	{
		Inflater inflater = new Inflater();
		try
		{
			inflater.setInput(input);
			UnsynchronizedByteArrayOutputStream output = UnsynchronizedByteArrayOutputStream.builder()
					.setBufferSize(Math.min(CHUNK_SIZE, uncompressedSize + 1))
					.get();
			byte[] chunk = new byte[CHUNK_SIZE];
			// one byte past the declared size is enough to detect a stream longer than declared
			long limit = (long) uncompressedSize + 1;
			while (!inflater.finished() && output.size() < limit)
			{
				int n = inflater.inflate(chunk, 0, (int) Math.min(chunk.length, limit - output.size()));
				if (n == 0 && (inflater.needsInput() || inflater.needsDictionary()))
					throw new CcfException.CorruptBlock(
							"Compressed block ended after " + output.size() + " bytes, expected " + uncompressedSize);
				output.write(chunk, 0, n);
			}
			int size = output.size();
			if (size != uncompressedSize || !inflater.finished())
				throw new CcfException.UncompressedSizeMismatch(uncompressedSize, size, inflater.finished());
			if (inflater.getRemaining() > 0)
				throw new CcfException.CorruptBlock(
						inflater.getRemaining() + " trailing bytes after the end of the compressed block");
			return output.toByteArray();
		}
		catch (DataFormatException ex)
		{
			throw new CcfException.CorruptBlock("Failed to decompress block: " + ex.getMessage(), ex);
		}
		finally
		{
			inflater.end();
		}
	}
}
