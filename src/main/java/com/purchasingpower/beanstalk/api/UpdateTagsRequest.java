package com.purchasingpower.beanstalk.api;

import com.purchasingpower.beanstalk.core.Tag;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Update tags request.
 *
 * @since 1.0.0
 */
@Data
public class UpdateTagsRequest {

    private String resourceArn;
    private List<Tag> tagsToAdd = new ArrayList<>();
    private List<String> tagsToRemove = new ArrayList<>();
}
