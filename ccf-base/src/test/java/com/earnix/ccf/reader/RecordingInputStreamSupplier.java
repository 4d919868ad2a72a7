package com.earnix.ccf.reader;

import org.apache.commons.lang3.tuple.ImmutablePair;
import org.apache.commons.lang3.tuple.Pair;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * An in-memory supplier that records every range requested and tracks streams left open
 */
class RecordingInputStreamSupplier extends ByteArrayInputStreamSupplier
{
	private final List<Pair<Long, Long>> requestedRanges = new ArrayList<>();
	private int openStreams = 0;

	RecordingInputStreamSupplier(byte[] data)
	{
		super(data);
	}

	@Override
	public InputStream createInputStream(long startOffset, long numBytesToRead) throws IOException
	{
		requestedRanges.add(new ImmutablePair<>(startOffset, numBytesToRead));
		InputStream delegate = super.createInputStream(startOffset, numBytesToRead);
		openStreams++;
		return new FilterInputStream(delegate)
		{
			private boolean closed = false;

			@Override
			public void close() throws IOException
			{
				if (!closed)
				{
					closed = true;
					openStreams--;
				}
				super.close();
			}
		};
	}

	List<Pair<Long, Long>> getRequestedRanges()
	{
		return requestedRanges;
	}

	void clearRequestedRanges()
	{
		requestedRanges.clear();
	}

	int getOpenStreams()
	{
		return openStreams;
	}
}
