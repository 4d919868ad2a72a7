package com.earnix.ccf.compressors;

import java.util.zip.Deflater;

/**
 * zlib-wrapped deflate at a fixed level. A fixed level and strategy make the output a pure function of the input.
 */
public class DeflateCompressor implements Compressor
{
	private final int level;

	public DeflateCompressor(int level)
	{
		if (level < Deflater.BEST_SPEED || level > Deflater.BEST_COMPRESSION)
			throw new IllegalArgumentException("Deflate level must be between 1 and 9: " + level);
		this.level = level;
	}

	@Override
	public int compress(byte[] input, byte[] output)
	{
		Deflater deflater = new Deflater(level);
		try
		{
			deflater.setInput(input);
			deflater.finish();
			int size = 0;
			while (!deflater.finished())
			{
				if (size == output.length)
					throw new IllegalStateException(
							"Output buffer of " + output.length + " bytes too small for " + input.length + " bytes");
				size += deflater.deflate(output, size, output.length - size);
			}
			return size;
		}
		finally
		{
			deflater.end();
		}
	}

	@Override
	public int maxCompressedLength(int numBytes)
	{
		// zlib's compressBound
		long bound = (long) numBytes + (numBytes >> 12) + (numBytes >> 14) + (numBytes >> 25) + 13;
		return Math.toIntExact(bound);
	}

	public int getLevel()
	{
		return level;
	}
}
