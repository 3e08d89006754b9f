package io.recur4j.core;

/**
 * Business fields of a job, copied from a series parent onto every generated or materialized
 * instance.
 *
 * <p>Bump {@link #VERSION} whenever a component is added or removed; stored snapshots carry the
 * version they were written with.
 */
public record JobSnapshot(
        // customer
        String businessName,
        String contactName,
        String phone,
        String addressLine1,
        String addressLine2,
        String city,
        String state,
        String postalCode,

        // job details
        String notes,
        String repairNotes,
        String trailerColor,
        String trailerSerial,
        String trailerDetails,
        String quote,
        String quoteText,
        boolean trailerColorOverwrite,

        // audit
        String createdBy
) {
    public static final int VERSION = 1;

    public static JobSnapshot empty() {
        return builder().build();
    }

    /**
     * Field-by-field copy for a new series instance.
     */
    public JobSnapshot copyForInstance() {
        return new JobSnapshot(
                businessName,
                contactName,
                phone,
                addressLine1,
                addressLine2,
                city,
                state,
                postalCode,
                notes,
                repairNotes,
                trailerColor,
                trailerSerial,
                trailerDetails,
                quote,
                quoteText,
                trailerColorOverwrite,
                createdBy
        );
    }

    /**
     * Label used in logs and calendar titles: "Business (Contact)", either name alone, or a
     * placeholder.
     */
    public String displayName() {
        boolean hasBusiness = businessName != null && !businessName.isBlank();
        boolean hasContact = contactName != null && !contactName.isBlank();
        if (hasBusiness && hasContact) {
            return businessName + " (" + contactName + ")";
        }
        if (hasBusiness) {
            return businessName;
        }
        if (hasContact) {
            return contactName;
        }
        return "No Name Provided";
    }

    public Builder toBuilder() {
        return new Builder()
                .businessName(businessName)
                .contactName(contactName)
                .phone(phone)
                .addressLine1(addressLine1)
                .addressLine2(addressLine2)
                .city(city)
                .state(state)
                .postalCode(postalCode)
                .notes(notes)
                .repairNotes(repairNotes)
                .trailerColor(trailerColor)
                .trailerSerial(trailerSerial)
                .trailerDetails(trailerDetails)
                .quote(quote)
                .quoteText(quoteText)
                .trailerColorOverwrite(trailerColorOverwrite)
                .createdBy(createdBy);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String businessName;
        private String contactName;
        private String phone;
        private String addressLine1;
        private String addressLine2;
        private String city;
        private String state;
        private String postalCode;
        private String notes;
        private String repairNotes;
        private String trailerColor;
        private String trailerSerial;
        private String trailerDetails;
        private String quote;
        private String quoteText;
        private boolean trailerColorOverwrite;
        private String createdBy;

        public Builder businessName(String businessName) {
            this.businessName = businessName;
            return this;
        }

        public Builder contactName(String contactName) {
            this.contactName = contactName;
            return this;
        }

        public Builder phone(String phone) {
            this.phone = phone;
            return this;
        }

        public Builder addressLine1(String addressLine1) {
            this.addressLine1 = addressLine1;
            return this;
        }

        public Builder addressLine2(String addressLine2) {
            this.addressLine2 = addressLine2;
            return this;
        }

        public Builder city(String city) {
            this.city = city;
            return this;
        }

        public Builder state(String state) {
            this.state = state;
            return this;
        }

        public Builder postalCode(String postalCode) {
            this.postalCode = postalCode;
            return this;
        }

        public Builder notes(String notes) {
            this.notes = notes;
            return this;
        }

        public Builder repairNotes(String repairNotes) {
            this.repairNotes = repairNotes;
            return this;
        }

        public Builder trailerColor(String trailerColor) {
            this.trailerColor = trailerColor;
            return this;
        }

        public Builder trailerSerial(String trailerSerial) {
            this.trailerSerial = trailerSerial;
            return this;
        }

        public Builder trailerDetails(String trailerDetails) {
            this.trailerDetails = trailerDetails;
            return this;
        }

        public Builder quote(String quote) {
            this.quote = quote;
            return this;
        }

        public Builder quoteText(String quoteText) {
            this.quoteText = quoteText;
            return this;
        }

        public Builder trailerColorOverwrite(boolean trailerColorOverwrite) {
            this.trailerColorOverwrite = trailerColorOverwrite;
            return this;
        }

        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
            return this;
        }

        public JobSnapshot build() {
            return new JobSnapshot(
                    businessName,
                    contactName,
                    phone,
                    addressLine1,
                    addressLine2,
                    city,
                    state,
                    postalCode,
                    notes,
                    repairNotes,
                    trailerColor,
                    trailerSerial,
                    trailerDetails,
                    quote,
                    quoteText,
                    trailerColorOverwrite,
                    createdBy
            );
        }
    }
}
