package deskgate.adapter.in.dto;

import java.util.List;

import deskgate.core.port.out.AcceptedUploadHandler.StoredFile;

/**
 * DTO for a successful upload.
 */
public record UploadResponse(String message, List<UploadedFileDto> data) {

    /**
     * One stored file.
     */
    public record UploadedFileDto(String filename, String mimeType, long size) {

        public static UploadedFileDto fromModel(StoredFile file) {
            return new UploadedFileDto(file.filename(), file.mimeType(), file.size());
        }
    }

    public static UploadResponse fromModel(List<StoredFile> files) {
        final var message = files.size() == 1 ? "File uploaded successfully" : "Files uploaded successfully";
        return new UploadResponse(message, files.stream().map(UploadedFileDto::fromModel).toList());
    }
}
