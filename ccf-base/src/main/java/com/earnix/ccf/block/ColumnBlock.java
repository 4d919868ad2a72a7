package com.earnix.ccf.block;

import com.earnix.ccf.schema.ColumnDescriptor;

import java.io.IOException;
import java.io.OutputStream;

/**
 * The compressed, ready to store form of one column
 */
public class ColumnBlock
{
	private final ColumnDescriptor descriptor;
	private final long numRows;
	private final byte[] compressedBytes;
	private final long uncompressedSize;

	public ColumnBlock(ColumnDescriptor descriptor, long numRows, byte[] compressedBytes, long uncompressedSize)
	{
		this.descriptor = descriptor;
		this.numRows = numRows;
		this.compressedBytes = compressedBytes;
		this.uncompressedSize = uncompressedSize;
	}

	public ColumnDescriptor getDescriptor()
	{
		return descriptor;
	}

	public long getNumRows()
	{
		return numRows;
	}

	public long getCompressedSize()
	{
		return compressedBytes.length;
	}

	public long getUncompressedSize()
	{
		return uncompressedSize;
	}

	public void writeToOutputStream(OutputStream os) throws IOException
	{
		os.write(compressedBytes);
	}

	/**
	 * @return a copy of the stored bytes
	 */
	public byte[] getCompressedBytes()
	{
		return compressedBytes.clone();
	}
}
