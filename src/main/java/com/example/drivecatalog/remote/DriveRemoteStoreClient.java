package com.example.drivecatalog.remote;

import com.example.drivecatalog.metadata.Entry;
import com.example.drivecatalog.metadata.EntryType;
import com.google.api.client.http.HttpResponseException;
import com.google.api.services.drive.Drive;
import com.google.api.services.drive.model.File;
import com.google.api.services.drive.model.FileList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link RemoteStoreClient} backed by the Google Drive v3 API.
 */
public final class DriveRemoteStoreClient implements RemoteStoreClient {
    private static final Logger LOGGER = LoggerFactory.getLogger(DriveRemoteStoreClient.class);

    static final String FOLDER_MIME_TYPE = "application/vnd.google-apps.folder";
    static final String NATIVE_MIME_PREFIX = "application/vnd.google-apps.";
    static final String LIST_FIELDS = "nextPageToken, files(id, name, mimeType, size, createdTime, "
            + "parents, webViewLink, videoMediaMetadata/durationMillis)";
    static final String GET_FIELDS = "id, name, mimeType, parents";

    private final Drive drive;
    private final int pageSize;

    public DriveRemoteStoreClient(Drive drive, int pageSize) {
        this.drive = drive;
        this.pageSize = pageSize;
    }

    @Override
    public EntryPage listEntries(String folderId, String pageToken) throws RemoteStoreException {
        String folder = folderId == null ? DRIVE_ROOT : folderId;
        try {
            FileList result = drive.files()
                    .list()
                    .setQ(folderQuery(folder))
                    .setPageSize(pageSize)
                    .setPageToken(pageToken)
                    .setFields(LIST_FIELDS)
                    .execute();
            List<Entry> entries = new ArrayList<>();
            if (result.getFiles() != null) {
                for (File file : result.getFiles()) {
                    entries.add(toEntry(file));
                }
            }
            LOGGER.debug("Listed {} entries in folder {}", entries.size(), folder);
            return new EntryPage(entries, result.getNextPageToken());
        } catch (HttpResponseException ex) {
            throw new EntryListException(ex.getStatusMessage(), folder, ex.getStatusCode(), ex);
        } catch (IOException ex) {
            throw new EntryListException(String.valueOf(ex.getMessage()), folder, null, ex);
        }
    }

    @Override
    public Entry getEntry(String id) throws RemoteStoreException {
        try {
            File file = drive.files()
                    .get(id)
                    .setFields(GET_FIELDS)
                    .execute();
            return toEntry(file);
        } catch (HttpResponseException ex) {
            if (ex.getStatusCode() == 404) {
                throw new EntryNotFoundException(id, ex);
            }
            throw new EntryLookupException(ex.getStatusMessage(), id, ex.getStatusCode(), ex);
        } catch (IOException ex) {
            throw new EntryLookupException(String.valueOf(ex.getMessage()), id, null, ex);
        }
    }

    static String folderQuery(String folderId) {
        return "'" + folderId.replace("\\", "\\\\").replace("'", "\\'") + "' in parents and trashed=false";
    }

    static EntryType classify(String mimeType) {
        if (FOLDER_MIME_TYPE.equals(mimeType)) {
            return EntryType.FOLDER;
        }
        if (mimeType != null && mimeType.startsWith(NATIVE_MIME_PREFIX)) {
            return EntryType.NATIVE_DOCUMENT;
        }
        return EntryType.REGULAR_FILE;
    }

    static Entry toEntry(File file) {
        List<String> parents = file.getParents();
        String parentId = parents == null || parents.isEmpty() ? null : parents.get(0);
        Long duration = file.getVideoMediaMetadata() == null ? null : file.getVideoMediaMetadata().getDurationMillis();
        return new Entry(
                file.getId(),
                file.getName(),
                classify(file.getMimeType()),
                file.getMimeType(),
                file.getSize(),
                file.getCreatedTime() == null ? null : file.getCreatedTime().toStringRfc3339(),
                parentId,
                file.getWebViewLink(),
                duration
        );
    }
}
