package com.earnix.ccf.file.reader;

import com.earnix.ccf.reader.CcfColumnarReader;
import com.earnix.ccf.reader.CcfColumnarReaderImpl;
import com.earnix.ccf.reader.CcfReaderInputStreamSupplier;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A factory to construct CCF File Readers
 */
public class CcfFileReaderFactory
{
	/**
	 * Open a CCF file. Only the header is read, column blocks are read when requested.
	 *
	 * @param ccfPath the path to the CCF file
	 * @return the reader
	 * @throws IOException on failure reading the header of the file
	 */
	public static CcfColumnarReader createColumnarFileReader(Path ccfPath) throws IOException
	{
		return new CcfColumnarReaderImpl(new CcfReaderInputStreamSupplier()
		{
			@Override
			public long getTotalLength() throws IOException
			{
				return Files.size(ccfPath);
			}

			@Override
			public InputStream createInputStream(long startOffset, long numBytesToRead) throws IOException
			{
				return new FileRangeInputStreamSupplier(ccfPath, startOffset, numBytesToRead).get();
			}
		});
	}

	private CcfFileReaderFactory()
	{
		// static methods ONLY
	}
}
