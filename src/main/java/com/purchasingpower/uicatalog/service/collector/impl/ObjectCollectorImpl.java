package com.purchasingpower.uicatalog.service.collector.impl;

import com.purchasingpower.uicatalog.model.design.CollectedObject;
import com.purchasingpower.uicatalog.model.design.DesignDocument;
import com.purchasingpower.uicatalog.model.design.DesignFile;
import com.purchasingpower.uicatalog.model.design.DesignObject;
import com.purchasingpower.uicatalog.model.design.DesignPage;
import com.purchasingpower.uicatalog.model.design.ObjectContext;
import com.purchasingpower.uicatalog.service.collector.ObjectCollector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
public class ObjectCollectorImpl implements ObjectCollector {

    @Override
    public List<CollectedObject> collect(DesignDocument document) {
        List<CollectedObject> collected = new ArrayList<>();
        if (document == null) {
            return collected;
        }

        for (Map.Entry<String, DesignFile> file : document.getFiles().entrySet()) {
            if (file.getValue() == null) {
                continue;
            }
            for (Map.Entry<String, DesignPage> page : file.getValue().getPages().entrySet()) {
                if (page.getValue() == null) {
                    continue;
                }
                for (Map.Entry<String, DesignObject> object : page.getValue().getObjects().entrySet()) {
                    DesignObject designObject = object.getValue() != null ? object.getValue() : new DesignObject();
                    ObjectContext context = new ObjectContext(file.getKey(), page.getKey(), object.getKey());
                    collected.add(new CollectedObject(collected.size(), designObject, context));
                }
            }
        }

        log.debug("Collected {} objects from {} files", collected.size(), document.getFiles().size());
        return collected;
    }
}
