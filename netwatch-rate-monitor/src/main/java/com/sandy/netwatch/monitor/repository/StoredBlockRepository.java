package com.sandy.netwatch.monitor.repository;

import com.sandy.netwatch.monitor.entity.StoredBlockRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface StoredBlockRepository extends JpaRepository<StoredBlockRecord, String> {

    @Query("select b.blockId from StoredBlockRecord b where b.blockId like concat(:prefix, '%') order by b.blockId")
    List<String> findIdsByPrefix(@Param("prefix") String prefix);
}
