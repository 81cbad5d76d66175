package com.wildvision.observations.repository;

import com.wildvision.observations.model.Gender;
import com.wildvision.observations.model.Observation;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Component
public class MongoObservationStore implements ObservationStore {

    private static final Logger log = LoggerFactory.getLogger(MongoObservationStore.class);

    private final MongoTemplate mongo;
    private final String collection;

    public MongoObservationStore(MongoTemplate mongo,
                                 @Value("${wildvision.mongo.collection:observations}") String collection) {
        this.mongo = mongo;
        this.collection = collection;
    }

    @Override
    public String insert(Observation observation) {
        // Generated client side, the same way the driver does for a missing _id.
        ObjectId id = new ObjectId();
        mongo.insert(toDocument(id, observation), collection);
        return id.toHexString();
    }

    @Override
    public List<Observation> findAll() {
        return mongo.findAll(ObservationDocument.class, collection).stream()
                .map(MongoObservationStore::toObservation)
                .toList();
    }

    @Override
    public Optional<Observation> findById(String id) {
        ObservationDocument document = mongo.findById(new ObjectId(id), ObservationDocument.class, collection);
        return Optional.ofNullable(document).map(MongoObservationStore::toObservation);
    }

    @Override
    public long deleteById(String id) {
        Query byId = Query.query(Criteria.where("_id").is(new ObjectId(id)));
        return mongo.remove(byId, ObservationDocument.class, collection).getDeletedCount();
    }

    @Override
    public boolean isValidId(String id) {
        return id != null && ObjectId.isValid(id);
    }

    private static ObservationDocument toDocument(ObjectId id, Observation observation) {
        return new ObservationDocument(
                id,
                observation.species(),
                observation.gender().label(),
                observation.quantity(),
                observation.latitude(),
                observation.longitude(),
                observation.userId(),
                observation.timestamp()
        );
    }

    private static Observation toObservation(ObservationDocument document) {
        Gender gender = Gender.fromLabel(document.gender()).orElseGet(() -> {
            log.warn("Observation {} has unrecognised gender '{}', reading it as Unknown",
                    document.id(), document.gender());
            return Gender.UNKNOWN;
        });
        return new Observation(
                document.id().toHexString(),
                document.species(),
                gender,
                document.quantity(),
                document.latitude(),
                document.longitude(),
                document.userId(),
                document.timestamp()
        );
    }
}
