package com.taskhub.repository;

import com.taskhub.model.entity.TaskAttachment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface TaskAttachmentRepository extends JpaRepository<TaskAttachment, Long> {

    List<TaskAttachment> findByTaskIdOrderByCreatedAtDesc(Long taskId);

    Optional<TaskAttachment> findByIdAndTaskId(Long id, Long taskId);

    @Query("SELECT a.filePath FROM TaskAttachment a")
    List<String> findAllFilePaths();
}
