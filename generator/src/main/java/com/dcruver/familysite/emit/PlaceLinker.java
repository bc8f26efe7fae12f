package com.dcruver.familysite.emit;

import com.dcruver.familysite.config.SiteProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Renders place names as links to their encyclopedia article.
 */
@Component
@RequiredArgsConstructor
public class PlaceLinker {

    private final SiteProperties properties;

    public String render(String place) {
        if (place == null || place.isBlank()) {
            return "";
        }
        SiteProperties.PlaceLinks links = properties.getPlaceLinks();
        if (!links.isEnabled()) {
            return place;
        }
        String article = links.getOverrides().getOrDefault(place, place.trim().replace(' ', '_'));
        return "[" + DocumentNaming.linkLabel(place) + "](<" + links.getBaseUrl() + article + ">)";
    }
}
