package me.golemcore.recall.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Model verdict on whether a message acts on an existing event.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActionDetection {

    private boolean action;

    @Builder.Default
    private ActionType type = ActionType.NONE;

    private double confidence;
    private String targetDescription;

    @Builder.Default
    private List<String> targetKeywords = new ArrayList<>();

    private Integer snoozeMinutes;
    private String newTime;
    private String newTitle;
    private String newLocation;
    private String newDescription;

    public static ActionDetection none() {
        return ActionDetection.builder().action(false).type(ActionType.NONE).confidence(0.0).build();
    }
}
