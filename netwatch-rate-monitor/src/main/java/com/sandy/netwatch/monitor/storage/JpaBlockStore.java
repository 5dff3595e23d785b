package com.sandy.netwatch.monitor.storage;

import com.sandy.netwatch.monitor.entity.StoredBlockRecord;
import com.sandy.netwatch.monitor.model.StoredBlock;
import com.sandy.netwatch.monitor.repository.StoredBlockRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Component
@Profile("!test")
@RequiredArgsConstructor
public class JpaBlockStore implements BlockStore {

    private final StoredBlockRepository repository;

    @Override
    @Transactional(readOnly = true)
    public Optional<StoredBlock> read(String blockId) {
        return repository.findById(blockId)
                .map(r -> new StoredBlock(r.getEncoding(), r.getPayload(), r.getSampleCount(), r.getRawSize()));
    }

    @Override
    @Transactional
    public void write(String blockId, StoredBlock block) {
        repository.save(StoredBlockRecord.builder()
                .blockId(blockId)
                .encoding(block.encoding())
                .payload(block.payload())
                .sampleCount(block.sampleCount())
                .rawSize(block.rawSize())
                .updatedAt(LocalDateTime.now())
                .build());
    }

    @Override
    @Transactional
    public void delete(String blockId) {
        if (repository.existsById(blockId)) {
            repository.deleteById(blockId);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> listIds(String prefix) {
        return repository.findIdsByPrefix(prefix).stream()
                .filter(id -> id.startsWith(prefix))
                .toList();
    }
}
