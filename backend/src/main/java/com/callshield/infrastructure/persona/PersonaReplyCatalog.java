package com.callshield.infrastructure.persona;

import com.callshield.domain.persona.model.PersonaProfile;
import com.callshield.domain.persona.model.ReplyIntent;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only reply policy per persona: stalling, feigned confusion and selective compliance.
 * No reply ever carries a real value.
 */
final class PersonaReplyCatalog {

    static final String FALLBACK_REPLY = "Hello? Sorry, the line is breaking up. Can you say that again?";

    private static final Map<PersonaProfile, Map<ReplyIntent, List<String>>> REPLIES = new EnumMap<>(PersonaProfile.class);
    private static final Map<PersonaProfile, List<String>> PROBES = new EnumMap<>(PersonaProfile.class);

    static {
        Map<ReplyIntent, List<String>> senior = new EnumMap<>(ReplyIntent.class);
        senior.put(ReplyIntent.IDENTITY_PROBE, List.of(
                "What? Speak louder please, my hearing aid is whistling again. I am Ramesh, who else would I be?",
                "Robot? Arre, my grandson says the same thing when I talk slowly. I am just old, beta."
        ));
        senior.put(ReplyIntent.FINANCIAL_REQUEST, List.of(
                "The card number? It is written somewhere under my spectacles case... one minute, I am searching.",
                "OTP? What is that, beta? Nobody told me about any OTP. Explain slowly what I have to do.",
                "Account number? The passbook is in the almirah. Let me ask my wife where the key is, please hold.",
                "The PIN is something my son set up. He is in office now. Should I call him and ask?"
        ));
        senior.put(ReplyIntent.THREAT, List.of(
                "Arrest? But I have done nothing wrong! I was a government servant for thirty years. Please help me.",
                "Police station? I cannot even walk that far. Tell me what I should do, I am very worried.",
                "A case against me? There must be some mistake. Please check the name again, sir."
        ));
        senior.put(ReplyIntent.URGENCY, List.of(
                "Slowly, slowly, beta. My heart is weak, I cannot do things so fast. Tell me step by step.",
                "Right now? I am still finding my spectacles. Please don't cut the call, I am coming."
        ));
        senior.put(ReplyIntent.TECH_REQUEST, List.of(
                "Download an app? I only know how to take calls on this phone. Which button do I press?",
                "AnyDesk? What is that, some shop? My grandson handles the phone, he is at school now."
        ));
        senior.put(ReplyIntent.VERIFICATION_REQUEST, List.of(
                "Aadhaar card? It is in the file with my pension papers. Let me look, it will take some time.",
                "KYC again? I did it at the branch last year. The manager there knows me, you can ask him."
        ));
        senior.put(ReplyIntent.PRIZE_OFFER, List.of(
                "I have won something? Really? I never win anything! What do I have to do to get it?",
                "A prize for me? God is kind. Tell me how it will come, by post or in the bank?"
        ));
        senior.put(ReplyIntent.GENERAL, List.of(
                "Hello? Who is speaking? Please speak a little louder, the network is weak here.",
                "Yes, yes, I am listening. Say it once more, I did not catch the last part.",
                "Haan ji, go on. I am writing it down in my diary, just repeat slowly."
        ));
        REPLIES.put(PersonaProfile.CONFUSED_SENIOR, senior);
        PROBES.put(PersonaProfile.CONFUSED_SENIOR, List.of(
                "Which UPI ID should my son send it to? Spell it for me slowly.",
                "Give me your phone number also, in case this call gets cut.",
                "What is your good name and which branch are you calling from?",
                "Tell me the account number where it has to go, I will write it in my diary."
        ));

        Map<ReplyIntent, List<String>> professional = new EnumMap<>(ReplyIntent.class);
        professional.put(ReplyIntent.IDENTITY_PROBE, List.of(
                "I could ask you the same question. You are the one who called me, so let us stick to your matter.",
                "Strange question. I am in the middle of a meeting, so please get to the point."
        ));
        professional.put(ReplyIntent.FINANCIAL_REQUEST, List.of(
                "Why would you need my card details? If you are from the bank, you should already have them.",
                "My bank has always said never to share an OTP. How do I know you are really from the bank?",
                "Before I share anything financial, give me a reference number I can verify with the branch."
        ));
        professional.put(ReplyIntent.THREAT, List.of(
                "If there is a genuine legal case, I should receive an official notice. What is the case number?",
                "I will consult my lawyer first. Send all the documents to my registered address.",
                "Give me your badge number and the station you are calling from. I will verify it myself."
        ));
        professional.put(ReplyIntent.URGENCY, List.of(
                "I don't make decisions under pressure. If this is urgent, email me the details.",
                "Everything is urgent today. Give me ten minutes, I need to check a few things first."
        ));
        professional.put(ReplyIntent.TECH_REQUEST, List.of(
                "I am not installing anything on my phone for an unknown caller. Why is this app necessary?",
                "Remote access to my device? Send me the official link from the company website instead."
        ));
        professional.put(ReplyIntent.VERIFICATION_REQUEST, List.of(
                "My KYC is complete, I got a confirmation last month. Which document do you think is missing?",
                "I can visit the branch with my documents. Which branch and which officer should I ask for?"
        ));
        professional.put(ReplyIntent.PRIZE_OFFER, List.of(
                "I don't remember entering any contest. Which company is this and how did you get my number?",
                "If I have won, deduct any charges from the prize itself. Why should I pay anything upfront?"
        ));
        professional.put(ReplyIntent.GENERAL, List.of(
                "Yes, this is Suresh. Who is calling and regarding what?",
                "I am listening, but please identify yourself properly first.",
                "Can you repeat that? I was reading an email."
        ));
        REPLIES.put(PersonaProfile.CAUTIOUS_PROFESSIONAL, professional);
        PROBES.put(PersonaProfile.CAUTIOUS_PROFESSIONAL, List.of(
                "Share your employee ID and a callback number so my accountant can verify you.",
                "Which account exactly should the payment go to? I need it in writing.",
                "Give me the official UPI handle, I will forward it to my accounts team.",
                "What is your full name and the address of your office?"
        ));

        Map<ReplyIntent, List<String>> homemaker = new EnumMap<>(ReplyIntent.class);
        homemaker.put(ReplyIntent.IDENTITY_PROBE, List.of(
                "Arre beta, what are you saying? I am Lakshmi, cooking dal right now. Tell me what you wanted.",
                "Machine? The pressure cooker is whistling, maybe that is what you heard. Go on, beta."
        ));
        homemaker.put(ReplyIntent.FINANCIAL_REQUEST, List.of(
                "Beta, I don't understand these things. Will you talk to my son? He handles all this.",
                "A message came, yes, but I cannot read it without my glasses. Wait a little, I am finding them.",
                "Card number? Okay, but first tell me your name. Where are you calling from?"
        ));
        homemaker.put(ReplyIntent.THREAT, List.of(
                "No, no! Please don't take any action, I have not done anything! I swear on God!",
                "Police? I am only a housewife, what do I know? Please talk to my husband, he will come home soon."
        ));
        homemaker.put(ReplyIntent.URGENCY, List.of(
                "Haan beta, I am doing it, don't shout. These phones are so confusing.",
                "So fast? Let me switch off the gas first, then I will do whatever you say."
        ));
        homemaker.put(ReplyIntent.TECH_REQUEST, List.of(
                "App? I only use WhatsApp for family videos. How do I download something new?",
                "Link? Where will it come, in the message? My daughter-in-law usually opens these things."
        ));
        homemaker.put(ReplyIntent.VERIFICATION_REQUEST, List.of(
                "Aadhaar is with my husband in his wallet. Should I call him?",
                "Which papers do you need, beta? I keep everything in one steel box, let me bring it."
        ));
        homemaker.put(ReplyIntent.PRIZE_OFFER, List.of(
                "Really, I won? How wonderful! My daughter's wedding is coming, this will help so much!",
                "Prize for me? Bhagwan ki kripa! Tell me, what do I have to do to get it?"
        ));
        homemaker.put(ReplyIntent.GENERAL, List.of(
                "Haan ji, namaste. Who is speaking?",
                "Hello? Yes beta, I can hear you. Tell me.",
                "Sorry, the children are making noise. What did you say?"
        ));
        REPLIES.put(PersonaProfile.TRUSTING_HOMEMAKER, homemaker);
        PROBES.put(PersonaProfile.TRUSTING_HOMEMAKER, List.of(
                "Where should I send it, beta? Tell me the UPI name slowly, I will ask my son to do it.",
                "Give me your number, beta, my son will call you back and do everything.",
                "What is your name, beta? And which city are you calling from?",
                "Which bank account should it go in? Say it slowly, I am writing."
        ));
    }

    private PersonaReplyCatalog() {
    }

    static List<String> replies(PersonaProfile persona, ReplyIntent intent) {
        return REPLIES.get(persona).get(intent);
    }

    static List<String> probes(PersonaProfile persona) {
        return PROBES.get(persona);
    }
}
