package com.sandy.netwatch.monitor.entity;

import com.sandy.netwatch.monitor.model.BlockEncoding;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * One encoded series block, addressed by {@code raw/<key>} or {@code agg/<key>}.
 */
@Entity
@Table(name = "series_blocks")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoredBlockRecord {
    @Id
    @Column(length = 255)
    private String blockId;

    @Enumerated(EnumType.STRING)
    @Column(length = 16, nullable = false)
    private BlockEncoding encoding;

    @Lob
    @Column(nullable = false)
    private byte[] payload;

    private int sampleCount;

    /** Uncompressed serialized size in bytes. */
    private int rawSize;

    private LocalDateTime updatedAt;
}
