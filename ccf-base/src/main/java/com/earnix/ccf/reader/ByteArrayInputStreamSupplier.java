package com.earnix.ccf.reader;

import org.apache.commons.io.input.UnsynchronizedByteArrayInputStream;

import java.io.IOException;
import java.io.InputStream;

/**
 * Supplies ranges of a CCF image held in memory
 */
public class ByteArrayInputStreamSupplier implements CcfReaderInputStreamSupplier
{
	private final byte[] data;

	public ByteArrayInputStreamSupplier(byte[] data)
	{
		this.data = data;
	}

	@Override
	public long getTotalLength()
	{
		return data.length;
	}

	@Override
	public InputStream createInputStream(long startOffset, long numBytesToRead) throws IOException
	{
		if (startOffset < 0 || numBytesToRead < 0 || startOffset + numBytesToRead > data.length)
			throw new IOException(
					"Range start: " + startOffset + " len: " + numBytesToRead + " outside of " + data.length
							+ " bytes");
		return UnsynchronizedByteArrayInputStream.builder()
				.setByteArray(data)
				.setOffset((int) startOffset)
				.setLength((int) numBytesToRead)
				.get();
	}
}
