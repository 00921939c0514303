package com.mk.fx.qa.process.sync.resource;

import com.mk.fx.qa.process.sync.dto.PoolStatusResponse;
import com.mk.fx.qa.process.sync.dto.SampleResponse;
import com.mk.fx.qa.process.sync.dto.StartPoolRequest;
import com.mk.fx.qa.process.sync.dto.WorkerViewResponse;
import com.mk.fx.qa.process.sync.events.SampleEvent;
import com.mk.fx.qa.process.sync.model.PriorityLevel;
import com.mk.fx.qa.process.sync.model.SpeedSetting;
import com.mk.fx.qa.process.sync.pool.PoolLaunchSpec;
import com.mk.fx.qa.process.sync.pool.PoolSnapshot;
import com.mk.fx.qa.process.sync.pool.WorkerView;
import java.time.Duration;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

@Mapper(componentModel = "spring")
public interface PoolMapper {

  @Mapping(target = "speed", source = "speed", qualifiedByName = "mapSpeed")
  @Mapping(target = "priority", source = "priority", qualifiedByName = "mapPriority")
  PoolLaunchSpec toLaunchSpec(StartPoolRequest request);

  @Mapping(target = "speed", source = "speed", qualifiedByName = "speedLabel")
  @Mapping(target = "durationSeconds", source = "duration", qualifiedByName = "toSeconds")
  WorkerViewResponse toResponse(WorkerView view);

  List<WorkerViewResponse> toWorkerResponses(List<WorkerView> views);

  @Mapping(target = "speed", source = "speed", qualifiedByName = "speedLabel")
  PoolStatusResponse toResponse(PoolSnapshot snapshot);

  SampleResponse toResponse(SampleEvent sample);

  List<SampleResponse> toSampleResponses(List<SampleEvent> samples);

  @Named("mapSpeed")
  default SpeedSetting mapSpeed(String speed) {
    return SpeedSetting.fromValue(speed);
  }

  @Named("mapPriority")
  default PriorityLevel mapPriority(String priority) {
    return PriorityLevel.fromValue(priority);
  }

  @Named("speedLabel")
  default String speedLabel(SpeedSetting speed) {
    return speed == null ? null : speed.label();
  }

  @Named("toSeconds")
  default Double toSeconds(Duration duration) {
    return duration == null ? null : duration.toNanos() / 1_000_000_000.0;
  }
}
