package com.earnix.ccf.reader;

import java.io.IOException;
import java.io.InputStream;

public interface CcfReaderInputStreamSupplier
{
	/**
	 * Get the total length of the CCF bytes
	 *
	 * @return the length in bytes
	 * @throws IOException on failure accessing the CCF bytes
	 */
	long getTotalLength() throws IOException;

	/**
	 * Create a new {@link InputStream} for the start offset to read the specified number of bytes
	 *
	 * @param startOffset    the start offset of the input stream
	 * @param numBytesToRead the number of bytes to read
	 * @return the created {@link InputStream}. The caller MUST close the returned stream
	 * @throws IOException on failure accessing the CCF bytes
	 */
	InputStream createInputStream(long startOffset, long numBytesToRead) throws IOException;
}
