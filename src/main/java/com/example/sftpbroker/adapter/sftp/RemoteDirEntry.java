package com.example.sftpbroker.adapter.sftp;

/**
 * One child of a remote directory listing.
 */
public record RemoteDirEntry(String name, RemoteAttributes attributes) {}
