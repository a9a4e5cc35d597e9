package com.example.drivecatalog.remote;

import com.google.api.client.auth.oauth2.Credential;
import com.google.api.client.extensions.java6.auth.oauth2.AuthorizationCodeInstalledApp;
import com.google.api.client.extensions.jetty.auth.oauth2.LocalServerReceiver;
import com.google.api.client.googleapis.auth.oauth2.GoogleAuthorizationCodeFlow;
import com.google.api.client.googleapis.auth.oauth2.GoogleClientSecrets;
import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.http.javanet.NetHttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.gson.GsonFactory;
import com.google.api.client.util.store.FileDataStoreFactory;
import com.google.api.services.drive.Drive;
import com.google.api.services.drive.DriveScopes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.util.List;

/**
 * Builds an authorized read-only {@link Drive} service using the installed-app OAuth flow.
 * Tokens are cached under the configured directory so later runs skip the browser step.
 */
public final class DriveServiceFactory {
    private static final Logger LOGGER = LoggerFactory.getLogger(DriveServiceFactory.class);
    private static final JsonFactory JSON_FACTORY = GsonFactory.getDefaultInstance();
    private static final List<String> SCOPES = List.of(DriveScopes.DRIVE_READONLY);

    private DriveServiceFactory() {
    }

    public static Drive create(Path credentialsFile, Path tokensDirectory, String applicationName) throws IOException {
        NetHttpTransport transport;
        try {
            transport = GoogleNetHttpTransport.newTrustedTransport();
        } catch (GeneralSecurityException ex) {
            throw new IOException("Unable to create trusted HTTP transport", ex);
        }
        Credential credential = authorize(transport, credentialsFile, tokensDirectory);
        return new Drive.Builder(transport, JSON_FACTORY, credential)
                .setApplicationName(applicationName)
                .build();
    }

    private static Credential authorize(NetHttpTransport transport, Path credentialsFile, Path tokensDirectory) throws IOException {
        GoogleClientSecrets secrets;
        try (Reader reader = Files.newBufferedReader(credentialsFile, StandardCharsets.UTF_8)) {
            secrets = GoogleClientSecrets.load(JSON_FACTORY, reader);
        }
        Files.createDirectories(tokensDirectory);
        GoogleAuthorizationCodeFlow flow = new GoogleAuthorizationCodeFlow.Builder(transport, JSON_FACTORY, secrets, SCOPES)
                .setDataStoreFactory(new FileDataStoreFactory(tokensDirectory.toFile()))
                .setAccessType("offline")
                .build();
        LOGGER.debug("Authorizing with client secrets from {}", credentialsFile);
        return new AuthorizationCodeInstalledApp(flow, new LocalServerReceiver()).authorize("user");
    }
}
