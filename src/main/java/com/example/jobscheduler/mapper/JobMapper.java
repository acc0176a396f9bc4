package com.example.jobscheduler.mapper;

import com.example.jobscheduler.domain.entity.JobEntity;
import com.example.jobscheduler.domain.model.ScheduledJob;
import com.example.jobscheduler.dto.JobResponse;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;
import org.mapstruct.ReportingPolicy;

import java.time.Duration;
import java.util.List;

/**
 * MapStruct mapper between the durable row, the in-memory job and the external view
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface JobMapper {

    @Mapping(target = "intervalMs", source = "interval", qualifiedByName = "durationToMillis")
    JobEntity toEntity(ScheduledJob job);

    @Mapping(target = "interval", source = "intervalMs", qualifiedByName = "millisToDuration")
    ScheduledJob toModel(JobEntity entity);

    List<ScheduledJob> toModels(List<JobEntity> entities);

    @Mapping(target = "intervalSeconds", source = "interval", qualifiedByName = "durationToSeconds")
    JobResponse toResponse(ScheduledJob job);

    List<JobResponse> toResponseList(List<ScheduledJob> jobs);

    @Named("durationToMillis")
    default long durationToMillis(Duration duration) {
        return duration != null ? duration.toMillis() : 0L;
    }

    @Named("millisToDuration")
    default Duration millisToDuration(long millis) {
        return Duration.ofMillis(millis);
    }

    @Named("durationToSeconds")
    default Double durationToSeconds(Duration duration) {
        return duration != null ? duration.toMillis() / 1000.0 : 0.0;
    }
}
