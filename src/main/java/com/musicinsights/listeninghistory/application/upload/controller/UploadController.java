package com.musicinsights.listeninghistory.application.upload.controller;

import com.musicinsights.listeninghistory.application.common.config.ListeningPipelineProperties;
import com.musicinsights.listeninghistory.application.common.error.BadRequestException;
import com.musicinsights.listeninghistory.application.job.UploadJob;
import com.musicinsights.listeninghistory.application.upload.dto.response.UploadStartResponse;
import com.musicinsights.listeninghistory.application.upload.service.ListeningIngestService;
import com.musicinsights.listeninghistory.application.upload.service.UploadStatusService;
import jakarta.validation.constraints.NotBlank;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.MediaType;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Locale;

/**
 * 청취 기록 내보내기 파일 업로드 API 컨트롤러.
 *
 * <p>파일을 받으면 job을 만들어 즉시 응답하고, 실제 처리는 백그라운드에서 진행한다.
 * 진행 상황은 상태 조회 API로 확인한다.</p>
 */
@RestController
@RequestMapping("/api/upload")
@Validated
public class UploadController {

    static final String USER_HEADER = "X-User-Id";

    private final ListeningIngestService ingestService;
    private final UploadStatusService statusService;
    private final int maxBytes;

    public UploadController(ListeningIngestService ingestService,
                            UploadStatusService statusService,
                            ListeningPipelineProperties props) {
        this.ingestService = ingestService;
        this.statusService = statusService;
        this.maxBytes = props.getUpload().getMaxBytes();
    }

    /**
     * 내보내기 파일(.zip 또는 .json)을 업로드한다.
     *
     * @param userId 사용자 ID
     * @param file   업로드 파일
     * @return 접수 응답(job ID 포함)
     */
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public Mono<UploadStartResponse> upload(
            @RequestHeader(USER_HEADER) @NotBlank String userId,
            @RequestPart("file") FilePart file
    ) {
        String fileName = file.filename();
        if (!isSupported(fileName)) {
            return Mono.error(new BadRequestException(
                    "Only .zip or .json export files are supported", "INVALID_FILE_TYPE"));
        }

        return DataBufferUtils.join(file.content(), maxBytes)
                .map(UploadController::toBytes)
                .filter(bytes -> bytes.length > 0)
                .switchIfEmpty(Mono.error(new BadRequestException("Uploaded file is empty", "EMPTY_FILE")))
                .map(bytes -> ingestService.start(userId, fileName, bytes))
                .map(job -> UploadStartResponse.accepted(job.id(), "Upload started. Processing in background..."));
    }

    /**
     * job 진행 상황을 조회한다.
     *
     * @param jobId job ID
     * @return job 상태
     */
    @GetMapping("/status")
    public Mono<UploadJob> status(@RequestParam @NotBlank String jobId) {
        return statusService.status(jobId);
    }

    static boolean isSupported(String fileName) {
        if (fileName == null) return false;
        String lower = fileName.toLowerCase(Locale.ROOT);
        return lower.endsWith(".zip") || lower.endsWith(".json");
    }

    private static byte[] toBytes(DataBuffer buffer) {
        try {
            byte[] bytes = new byte[buffer.readableByteCount()];
            buffer.read(bytes);
            return bytes;
        } finally {
            DataBufferUtils.release(buffer);
        }
    }
}
