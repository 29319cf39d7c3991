package org.pubkit.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import org.pubkit.model.enums.Profile;
import org.pubkit.model.enums.ReadingProgression;

import java.util.List;
import java.util.Set;

@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class Metadata {
    String identifier;
    String title;
    String subtitle;
    @Builder.Default
    List<String> languages = List.of();
    @Builder.Default
    List<String> authors = List.of();
    @Builder.Default
    List<String> publishers = List.of();
    String description;
    String published;
    String modified;
    ReadingProgression readingProgression;
    @Builder.Default
    Set<Profile> conformsTo = Set.of();
    Presentation presentation;
}
