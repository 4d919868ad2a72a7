package com.earnix.ccf.compressors;

import com.earnix.ccf.CcfException;

public interface Decompressor
{
	/**
	 * Decompress a block whose uncompressed length is known up front
	 *
	 * @param input            the compressed bytes
	 * @param uncompressedSize the declared uncompressed length
	 * @return exactly uncompressedSize bytes
	 * @throws CcfException.CorruptBlock if the input cannot be decompressed or does not decompress to exactly
	 *                                   uncompressedSize bytes
	 */
	byte[] decompress(byte[] input, int uncompressedSize) throws CcfException.CorruptBlock;
}
