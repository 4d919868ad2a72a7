package com.earnix.ccf.writer;

import com.earnix.ccf.metadata.CcfFileMetaData;

/**
 * Information about a CCF file that was persisted.
 */
public class CcfFileInfo
{
	private final long totalFileSize;
	private final CcfFileMetaData fileMetaData;

	public CcfFileInfo(long totalFileSize, CcfFileMetaData fileMetaData)
	{
		this.totalFileSize = totalFileSize;
		this.fileMetaData = fileMetaData;
	}

	/**
	 * Get the size of the file in bytes including the header.
	 *
	 * @return the size of the file
	 */
	public long getTotalFileSize()
	{
		return totalFileSize;
	}

	public CcfFileMetaData getFileMetaData()
	{
		return fileMetaData;
	}

	@Override
	public String toString()
	{
		return "CcfFileInfo{" + "totalFileSize=" + totalFileSize + ", fileMetaData=" + fileMetaData + '}';
	}
}
